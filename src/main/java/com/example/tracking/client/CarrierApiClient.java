package com.example.tracking.client;

import com.example.tracking.model.CarrierTrackingInfo;

import java.util.Collection;
import java.util.Map;

/**
 * Outbound view of the carrier aggregation API.
 */
public interface CarrierApiClient {

    /**
     * Query current status and events for a batch of tracking numbers.
     * Numbers the carrier knows nothing about may be missing from the result.
     *
     * @throws com.example.tracking.service.CarrierTransportException if the API cannot be reached,
     *         times out, or answers with a non-2xx status
     * @throws com.example.tracking.service.CarrierDecodeException if the response body is malformed
     */
    Map<String, CarrierTrackingInfo> query(Collection<String> trackingNumbers);
}
