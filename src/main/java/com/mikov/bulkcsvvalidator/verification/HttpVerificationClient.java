package com.mikov.bulkcsvvalidator.verification;

import com.mikov.bulkcsvvalidator.config.PipelineSettings;
import com.mikov.bulkcsvvalidator.dtos.VerificationServiceResponse;
import com.mikov.bulkcsvvalidator.model.VerificationOutcome;
import com.mikov.bulkcsvvalidator.validation.AddressPreFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Calls the verification service over HTTPS, one address per request.
 * This is the only layer that retries verification calls.
 *
 * @author zahari.mikov
 */
@Slf4j
@Service
public class HttpVerificationClient implements VerificationClient {

    private final RestTemplate restTemplate;
    private final RetryTemplate retryTemplate;
    private final AddressPreFilter preFilter;
    private final String baseUrl;

    public HttpVerificationClient(@Qualifier("verificationRestTemplate") final RestTemplate restTemplate,
                                  @Qualifier("verificationRetryTemplate") final RetryTemplate retryTemplate,
                                  final AddressPreFilter preFilter,
                                  final PipelineSettings settings) {
        this.restTemplate = restTemplate;
        this.retryTemplate = retryTemplate;
        this.preFilter = preFilter;
        this.baseUrl = settings.getVerificationBaseUrl();
    }

    @Override
    public VerificationOutcome verify(final String address) {
        final var normalized = address == null ? "" : address.trim();
        final var rejection = preFilter.rejectionReason(normalized);
        if (rejection.isPresent()) {
            log.debug("Skipping verification service for '{}': {}", normalized, rejection.get());
            return VerificationOutcome.rejectedLocally(normalized, rejection.get());
        }

        final var uri = buildUri(normalized);
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.info("Retrying verification of {} (attempt {})", normalized, context.getRetryCount() + 1);
                }
                final var response = restTemplate.getForObject(uri, VerificationServiceResponse.class);
                if (response == null || response.emailStatus() == null) {
                    throw new RestClientException("Verification service returned no status for " + normalized);
                }
                log.debug("Verified {}: {}", normalized, response.emailStatus());
                return VerificationOutcome.fromService(normalized, response);
            });
        } catch (final RestClientException e) {
            log.warn("Giving up on {} after retries: {}", normalized, e.getMessage());
            return VerificationOutcome.serviceError(normalized, e.getMessage());
        }
    }

    private URI buildUri(final String address) {
        // expanded as a variable so '+' and '@' are percent-encoded
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
            .queryParam("email", "{email}")
            .encode()
            .buildAndExpand(address)
            .toUri();
    }
}
