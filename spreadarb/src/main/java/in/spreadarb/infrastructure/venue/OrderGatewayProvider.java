package in.spreadarb.infrastructure.venue;

import in.spreadarb.config.ArbitrageConfig;

/**
 * Service-provider hook for LIVE gateways.
 *
 * Implementations are discovered with {@link java.util.ServiceLoader} from
 * {@code META-INF/services/in.spreadarb.infrastructure.venue.OrderGatewayProvider}.
 */
public interface OrderGatewayProvider {

    /**
     * Venue name this provider connects to, matched case-insensitively against the reference feed name.
     */
    String venue();

    OrderGateway create(ArbitrageConfig config);
}
