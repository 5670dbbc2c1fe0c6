package de.familyboard.calendar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Infrastructure shared by the calendar components: the HTTP client, the pool the
 * aggregator fans out on, and the clock.
 */
@Configuration(proxyBeanMethods = false)
class CalendarConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CalendarConfiguration.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);

    @Bean
    HttpClient calendarHttpClient(CalendarProperties properties) {
        var connectTimeout = properties.fetchTimeout().compareTo(CONNECT_TIMEOUT) < 0
                ? properties.fetchTimeout() : CONNECT_TIMEOUT;
        var clientBuilder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);

        if (properties.trustAllCertificates()) {
            log.warn("Certificate validation is disabled for calendar feeds (calendar.trust-all-certificates)");
            clientBuilder.sslContext(acceptingSslContext());
        }
        return clientBuilder.build();
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService calendarFetchExecutor(CalendarProperties properties) {
        var threadFactory = new CustomizableThreadFactory("calendar-fetch-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(properties.fetchThreads(), threadFactory);
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * TLS context for self-hosted feeds with self-signed certificates: any server chain
     * is accepted.
     */
    static SSLContext acceptingSslContext() {
        try {
            var context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[]{new AcceptingTrustManager()}, null);
            return context;
        } catch (GeneralSecurityException e) {
            throw new CalendarException("Cannot disable certificate validation for calendar feeds.", e);
        }
    }

    private static final class AcceptingTrustManager implements X509TrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
