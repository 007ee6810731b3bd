package com.williamcallahan.local_seo_engine.test.annotations;

import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Composed annotation for Postgres-backed tests.
 * - Only runs when SPRING_DATASOURCE_URL points at PostgreSQL
 * - Uses the "test" profile, which applies schema.sql and disables the scheduler
 * - Rolls back each test method
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@SpringBootTest
@ActiveProfiles("test")
@EnabledIfEnvironmentVariable(named = "SPRING_DATASOURCE_URL", matches = "jdbc:postgresql://.+")
@Transactional
public @interface DbIntegrationTest {
}
