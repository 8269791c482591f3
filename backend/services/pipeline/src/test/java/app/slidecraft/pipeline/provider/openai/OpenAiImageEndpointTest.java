package app.slidecraft.pipeline.provider.openai;

import app.slidecraft.pipeline.provider.ImagePrompt;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.core.io.ClassPathResource;

import java.util.Properties;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class OpenAiImageEndpointTest {

    private static final Set<String> GPT_IMAGE_SIZES = Set.of("1024x1024", "1536x1024", "1024x1536", "auto");

    @Test
    void requestSizeFollowsPromptDimensionsWhenNotOverridden() {
        ImagePrompt prompt = new ImagePrompt("A robot arm", "professional", 1536, 1024);

        assertEquals("1536x1024", OpenAiImageEndpoint.sizeFor(prompt, null));
        assertEquals("1536x1024", OpenAiImageEndpoint.sizeFor(prompt, " "));
        assertEquals("1024x1024", OpenAiImageEndpoint.sizeFor(prompt, "1024x1024"));
    }

    @Test
    void defaultImageDimensionsAreASizeTheImageModelAccepts() {
        YamlPropertiesFactoryBean yaml = new YamlPropertiesFactoryBean();
        yaml.setResources(new ClassPathResource("application.yml"));
        Properties properties = yaml.getObject();

        String width = properties.getProperty("app.pipeline.images.width");
        String height = properties.getProperty("app.pipeline.images.height");
        ImagePrompt prompt = new ImagePrompt("slide", "professional", Integer.parseInt(width), Integer.parseInt(height));

        assertThat(properties.getProperty("app.ai.openai.default-image-model")).contains("gpt-image-1");
        assertThat(OpenAiImageEndpoint.sizeFor(prompt, null)).isIn(GPT_IMAGE_SIZES);
    }
}
