/**
 * Enables S3-backed beans only when bucket credentials are configured
 *
 * Features:
 * - Accepts either the s3.* properties or the S3_* environment variables
 * - Requires access key, secret key and bucket; the server URL is optional (AWS S3 when absent)
 * - Logs the decision once per JVM
 */
package com.williamcallahan.trivia_image_curator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.env.Environment;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.lang.NonNull;

import java.util.concurrent.atomic.AtomicBoolean;

public class S3EnvironmentCondition implements Condition {

    private static final Logger logger = LoggerFactory.getLogger(S3EnvironmentCondition.class);
    private static final AtomicBoolean messageLogged = new AtomicBoolean(false);

    @Override
    public boolean matches(@NonNull ConditionContext context, @NonNull AnnotatedTypeMetadata metadata) {
        Environment env = context.getEnvironment();
        boolean hasRequiredVars = hasText(resolve(env, "s3.access-key-id", "S3_ACCESS_KEY_ID"))
            && hasText(resolve(env, "s3.secret-access-key", "S3_SECRET_ACCESS_KEY"))
            && hasText(resolve(env, "s3.bucket-name", "S3_BUCKET"));

        if (messageLogged.compareAndSet(false, true)) {
            if (hasRequiredVars) {
                logger.info("S3 configuration detected - enabling image storage");
            } else {
                logger.warn("S3 configuration not found - image storage and orphan cleanup will be disabled");
            }
        }
        return hasRequiredVars;
    }

    private static String resolve(Environment env, String property, String envVar) {
        String value = env.getProperty(property);
        return hasText(value) ? value : env.getProperty(envVar);
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
