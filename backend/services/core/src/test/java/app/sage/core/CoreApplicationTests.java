package app.sage.core;

import app.sage.core.support.PostgresIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class CoreApplicationTests extends PostgresIntegrationTest {

	@Test
	void contextLoads() {
	}

}
