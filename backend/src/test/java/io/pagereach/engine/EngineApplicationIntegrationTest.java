package io.pagereach.engine;

import static org.assertj.core.api.Assertions.assertThat;

import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.core.env.Environment;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class EngineApplicationIntegrationTest {

  @Autowired private Flyway flyway;
  @Autowired private Environment environment;

  @Test
  void contextLoads_withMigratedSchemaValidatedByHibernate() {
    assertThat(environment.getProperty("spring.jpa.hibernate.ddl-auto")).isEqualTo("validate");
    assertThat(flyway.info().current().getVersion().getVersion()).isEqualTo("2");
    assertThat(flyway.info().pending()).isEmpty();
  }
}
