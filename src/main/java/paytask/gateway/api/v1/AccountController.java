package paytask.gateway.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import paytask.gateway.api.Controller;
import paytask.gateway.api.v1.dto.AddressResponse;
import paytask.gateway.config.GatewayConfig;
import paytask.gateway.ledger.AccountAddress;
import paytask.gateway.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ledger addresses (public API).
 * 
 * GET /api/v1/address - Address payments must be sent to
 * GET /api/v1/address/{principal} - Address of any identity
 */
public class AccountController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(AccountController.class);

    private static final String SERVICE_ADDRESS_PATH = "/api/v1/address";
    private static final Pattern PRINCIPAL_ADDRESS_PATTERN = Pattern.compile("^/api/v1/address/([^/]+)$");

    private final String serviceIdentity;

    public AccountController(GatewayConfig config) {
        this.serviceIdentity = config.serviceIdentity();
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && (SERVICE_ADDRESS_PATH.equals(path) || PRINCIPAL_ADDRESS_PATTERN.matcher(path).matches());
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String identity = serviceIdentity;
            Matcher matcher = PRINCIPAL_ADDRESS_PATTERN.matcher(path);
            if (matcher.matches()) {
                identity = QueryStringDecoder.decodeComponent(matcher.group(1));
            }

            AddressResponse response = new AddressResponse(identity, AccountAddress.of(identity).toHex());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Account controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
