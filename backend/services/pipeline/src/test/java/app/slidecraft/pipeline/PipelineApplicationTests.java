package app.slidecraft.pipeline;

import app.slidecraft.pipeline.support.PostgresIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class PipelineApplicationTests extends PostgresIntegrationTest {

	@Test
	void contextLoads() {
	}

}
