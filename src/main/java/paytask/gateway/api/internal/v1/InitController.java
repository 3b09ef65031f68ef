package paytask.gateway.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import paytask.gateway.api.Controller;
import paytask.gateway.api.internal.v1.dto.InitRequest;
import paytask.gateway.api.internal.v1.dto.OperationResponse;
import paytask.gateway.config.FeeRegistry;
import paytask.gateway.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * One-time fee initialization (operator API).
 * POST /internal/v1/init
 */
public class InitController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(InitController.class);

    private final FeeRegistry feeRegistry;

    public InitController(FeeRegistry feeRegistry) {
        this.feeRegistry = feeRegistry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/internal/v1/init".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String body = req.content().toString(StandardCharsets.UTF_8);
            InitRequest request = RouterHandler.mapper().readValue(body, InitRequest.class);
            request.validate();

            if (feeRegistry.isInitialized()) {
                return ControllerResponse.json(HttpResponseStatus.CONFLICT,
                        RouterHandler.mapper().writeValueAsString(OperationResponse.alreadyInitialized()));
            }
            feeRegistry.initialize(request.toFeeSchedule());
            log.info("Fees initialized via operator API");

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));

        } catch (IllegalStateException e) {
            // lost a race with a concurrent init
            return ControllerResponse.conflict(e.getMessage());
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Init controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
