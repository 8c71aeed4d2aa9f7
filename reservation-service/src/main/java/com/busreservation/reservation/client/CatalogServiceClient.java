package com.busreservation.reservation.client;

import com.busreservation.reservation.dto.BusEntry;
import com.busreservation.reservation.dto.RouteEntry;
import com.busreservation.reservation.exception.ServiceUnavailableException;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

/**
 * Read-only client for the catalog service (operators, routes, buses).
 * Base URL and timeouts come from {@code catalogRestTemplate}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE)
public class CatalogServiceClient {

    final RestTemplate restTemplate;

    public Optional<BusEntry> getBus(String busId) {
        return get("/v1/buses/" + busId, BusEntry.class, "Bus", busId);
    }

    public Optional<RouteEntry> getRoute(String routeId) {
        return get("/v1/routes/" + routeId, RouteEntry.class, "Route", routeId);
    }

    private <T> Optional<T> get(String path, Class<T> type, String kind, String id) {
        log.debug("Calling catalog service: GET {}", path);

        try {
            ResponseEntity<T> response = restTemplate.getForEntity(path, type);
            log.debug("Catalog service response: status={}", response.getStatusCode());
            return Optional.ofNullable(response.getBody());
        } catch (HttpClientErrorException.NotFound e) {
            log.warn("{} not found in catalog: {}", kind, id);
            return Optional.empty();
        } catch (ResourceAccessException e) {
            log.error("Catalog service unavailable: {}", e.getMessage(), e);
            throw new ServiceUnavailableException("Catalog service unavailable", e);
        } catch (RestClientException e) {
            log.error("Error calling catalog service: type={}, message={}",
                    e.getClass().getName(), e.getMessage(), e);
            throw new ServiceUnavailableException("Error communicating with catalog service", e);
        }
    }
}
