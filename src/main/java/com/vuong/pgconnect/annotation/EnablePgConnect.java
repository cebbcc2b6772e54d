package com.vuong.pgconnect.annotation;

import com.vuong.pgconnect.config.AutoConfig;
import org.springframework.context.annotation.Import;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation to enable pg-connect in a Spring Boot application.
 * This imports the {@link com.vuong.pgconnect.config.AutoConfig} class, which binds the
 * {@code pgconnect.*} properties and opens a shared {@link com.vuong.pgconnect.core.connection.Database}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Import({AutoConfig.class})
public @interface EnablePgConnect {
}
