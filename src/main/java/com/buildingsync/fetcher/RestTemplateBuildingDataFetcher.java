package com.buildingsync.fetcher;

import com.buildingsync.config.BuildingSyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;

/**
 * Thin client over the buildings-energy endpoint.
 * Caching is disabled on every request so each poll sees fresh data.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RestTemplateBuildingDataFetcher implements BuildingDataFetcher {
    
    private final RestTemplate restTemplate;
    private final BuildingSyncProperties properties;
    private final AccessTokenProvider accessTokenProvider;
    
    @Override
    public String fetch() throws TransportException {
        String url = energyUrl();
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setCacheControl("no-cache, no-store, must-revalidate");
        headers.setPragma("no-cache");
        accessTokenProvider.currentToken().ifPresent(headers::setBearerAuth);
        
        log.debug("Fetching {}", url);
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), String.class);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 401) {
                accessTokenProvider.onCredentialExpired();
            }
            throw new TransportException("HTTP " + status + " from " + url, status);
        } catch (ResourceAccessException e) {
            throw new TransportException("I/O error calling " + url + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new TransportException("Request to " + url + " failed: " + e.getMessage(), e);
        }
        
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new TransportException("HTTP " + response.getStatusCode().value() + " from " + url,
                    response.getStatusCode().value());
        }
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            throw new TransportException("Empty response from " + url, response.getStatusCode().value());
        }
        return body;
    }
    
    String energyUrl() {
        BuildingSyncProperties.Source source = properties.getSource();
        return UriComponentsBuilder
                .fromHttpUrl(source.getBaseUrl() + source.getEnergyPath())
                .queryParam("community_id", source.getCommunityId())
                .queryParam("field_type", source.getFieldType())
                .toUriString();
    }
}
