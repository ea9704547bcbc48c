package com.ewale.ewale.service;

import com.ewale.ewale.entity.CommissionServiceType;
import com.ewale.ewale.entity.NetworkProvider;
import com.ewale.ewale.entity.TvProvider;
import com.ewale.ewale.entity.UtilityProvider;
import com.ewale.ewale.dto.CommissionServiceRequest;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Commission Services endpoint ids per product line and provider.
 */
@Component
public class HubtelEndpoints {

    private final Map<NetworkProvider, String> airtime = new EnumMap<>(NetworkProvider.class);
    private final Map<NetworkProvider, String> bundle = new EnumMap<>(NetworkProvider.class);
    private final Map<TvProvider, String> tv = new EnumMap<>(TvProvider.class);
    private final Map<UtilityProvider, String> utility = new EnumMap<>(UtilityProvider.class);

    public HubtelEndpoints() {
        airtime.put(NetworkProvider.MTN, "fdd76c884e614b1c8f669a3207b09a98");
        airtime.put(NetworkProvider.TELECEL, "f4be83ad74c742e185224fdae1304800");
        airtime.put(NetworkProvider.AT, "dae2142eb5a14c298eace60240c09e4b");

        bundle.put(NetworkProvider.MTN, "b230733cd56b4a0fad820e39f66bc27c");
        bundle.put(NetworkProvider.TELECEL, "fa27127ba039455da04a2ac8a1613e00");
        bundle.put(NetworkProvider.AT, "06abd92da459428496967612463575ca");

        tv.put(TvProvider.DSTV, "297a96656b5846ad8b00d5d41b256ea7");
        tv.put(TvProvider.GOTV, "e6ceac7f3880435cb30b048e9617eb41");
        tv.put(TvProvider.STARTIMES, "6598652d34ea4112949c93c079c501ce");

        utility.put(UtilityProvider.ECG, "e6d6bac062b5499cb1ece1ac3d742a84");
        utility.put(UtilityProvider.GHANA_WATER, "6c1e8a82d2e84feeb8bfd6be2790d71d");
    }

    public String airtime(NetworkProvider network) {
        return airtime.get(network);
    }

    public String bundle(NetworkProvider network) {
        return bundle.get(network);
    }

    public String tv(TvProvider provider) {
        return tv.get(provider);
    }

    public String utility(UtilityProvider provider) {
        return utility.get(provider);
    }

    /**
     * @return the endpoint id, or null when the request lacks the provider for its service type
     */
    public String forRequest(CommissionServiceRequest request) {
        CommissionServiceType type = request.getServiceType();
        if (type == null) {
            return null;
        }
        switch (type) {
            case AIRTIME:
                return request.getNetwork() != null ? airtime(request.getNetwork()) : null;
            case BUNDLE:
                return request.getNetwork() != null ? bundle(request.getNetwork()) : null;
            case TV_BILL:
                return request.getTvProvider() != null ? tv(request.getTvProvider()) : null;
            case UTILITY:
                return request.getUtilityProvider() != null ? utility(request.getUtilityProvider()) : null;
            default:
                return null;
        }
    }
}
