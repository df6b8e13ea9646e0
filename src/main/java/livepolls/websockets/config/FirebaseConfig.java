package livepolls.websockets.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.cloud.FirestoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.util.StringUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Base64;

/**
 * Firestore client for the poll archive. Only loaded when archive credentials are configured,
 * either inline as base64 ({@code app.firebase.credentials}) or as a classpath file
 * ({@code app.firebase.credentials-file}); otherwise no {@link Firestore} bean exists.
 */
@Configuration
@Conditional(FirebaseConfig.ArchiveCredentialsPresent.class)
public class FirebaseConfig {

    private static final Logger log = LoggerFactory.getLogger(FirebaseConfig.class);

    static final String ARCHIVE_APP_NAME = "poll-archive";

    @Bean(destroyMethod = "delete")
    public FirebaseApp archiveFirebaseApp(
            @Value("${app.firebase.credentials:}") String inlineCredentials,
            @Value("${app.firebase.credentials-file:}") String credentialsFile
    ) throws IOException {
        FirebaseOptions options = FirebaseOptions.builder()
                .setCredentials(archiveCredentials(inlineCredentials, credentialsFile))
                .build();

        FirebaseApp app = FirebaseApp.initializeApp(options, ARCHIVE_APP_NAME);
        log.info("Poll archive connected to Firebase project {}", app.getOptions().getProjectId());
        return app;
    }

    @Bean
    public Firestore archiveFirestore(FirebaseApp archiveFirebaseApp) {
        return FirestoreClient.getFirestore(archiveFirebaseApp);
    }

    static GoogleCredentials archiveCredentials(String inlineCredentials, String credentialsFile) throws IOException {
        if (StringUtils.hasText(inlineCredentials)) {
            byte[] json = Base64.getDecoder().decode(inlineCredentials.trim());
            return GoogleCredentials.fromStream(new ByteArrayInputStream(json));
        }

        ClassPathResource resource = new ClassPathResource(credentialsFile);
        if (!resource.exists()) {
            throw new IllegalStateException("Poll archive credentials file not found on classpath: " + credentialsFile);
        }
        try (InputStream in = resource.getInputStream()) {
            return GoogleCredentials.fromStream(in);
        }
    }

    static class ArchiveCredentialsPresent implements Condition {

        @Override
        public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
            Environment environment = context.getEnvironment();
            boolean configured = StringUtils.hasText(environment.getProperty("app.firebase.credentials"))
                    || StringUtils.hasText(environment.getProperty("app.firebase.credentials-file"));
            if (!configured) {
                log.warn("Firebase credentials not configured. Poll archive will be disabled.");
            }
            return configured;
        }
    }
}
