package app.slidecraft.pipeline.support;

import app.slidecraft.pipeline.provider.GeneratedImage;
import app.slidecraft.pipeline.provider.ImageGenerationEndpoint;
import app.slidecraft.pipeline.provider.ImagePrompt;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

public class ScriptedImageEndpoint implements ImageGenerationEndpoint {

    private final Function<ImagePrompt, GeneratedImage> script;
    private final AtomicInteger calls = new AtomicInteger();

    public ScriptedImageEndpoint(Function<ImagePrompt, GeneratedImage> script) {
        this.script = script;
    }

    @Override
    public String provider() {
        return "scripted";
    }

    @Override
    public String model() {
        return "scripted-model";
    }

    @Override
    public GeneratedImage generate(ImagePrompt prompt) {
        calls.incrementAndGet();
        return script.apply(prompt);
    }

    public int calls() {
        return calls.get();
    }
}
