package com.pulsarr.spring;

import com.pulsarr.adapter.spring.RouterAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the content router in a Spring Boot application.
 * 
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableContentRouter
 * public class MyApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyApplication.class, args);
 *     }
 * }
 * </pre>
 * Add {@code @EnableScheduling} as well to run the approval expiry sweep.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(RouterAutoConfiguration.class)
public @interface EnableContentRouter {
}
