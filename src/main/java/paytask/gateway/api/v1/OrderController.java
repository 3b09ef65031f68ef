package paytask.gateway.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import paytask.gateway.api.Controller;
import paytask.gateway.api.v1.dto.MessageResponse;
import paytask.gateway.api.v1.dto.PaymentOrderResponse;
import paytask.gateway.model.PaymentOrder;
import paytask.gateway.model.ServiceResult;
import paytask.gateway.server.RouterHandler;
import paytask.gateway.service.OrderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Controller for payment orders (public API).
 * 
 * POST /api/v1/orders - Reserve an order for the caller
 * GET /api/v1/orders/settled - Last settled order of the caller
 */
public class OrderController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private static final String ORDERS_PATH = "/api/v1/orders";
    private static final String SETTLED_PATH = "/api/v1/orders/settled";

    private final OrderService orderService;

    public OrderController(OrderService orderService) {
        this.orderService = orderService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return (method.equals(HttpMethod.POST) && ORDERS_PATH.equals(path))
                || (method.equals(HttpMethod.GET) && SETTLED_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String caller = Controller.requireCaller(req);
            if (req.method().equals(HttpMethod.POST)) {
                return handleReserve(caller);
            }
            return handleSettled(caller);

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Order controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleReserve(String caller) throws Exception {
        ServiceResult<PaymentOrder> result = orderService.reserve(caller);
        if (!result.isSuccess()) {
            return ControllerResponse.json(
                    ControllerResponse.statusOf(result.message()),
                    RouterHandler.mapper().writeValueAsString(MessageResponse.from(result.message())));
        }

        PaymentOrderResponse response = PaymentOrderResponse.from(result.orElseThrow());
        return ControllerResponse.json(HttpResponseStatus.CREATED, RouterHandler.mapper().writeValueAsString(response));
    }

    private ControllerResponse handleSettled(String caller) throws Exception {
        Optional<PaymentOrder> settled = orderService.findSettled(caller);
        if (settled.isEmpty()) {
            return ControllerResponse.notFound("no settled order for caller");
        }
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(PaymentOrderResponse.from(settled.get())));
    }
}
