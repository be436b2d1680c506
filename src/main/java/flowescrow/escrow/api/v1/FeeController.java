package flowescrow.escrow.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import flowescrow.escrow.api.Controller;
import flowescrow.escrow.api.v1.dto.FeeResponse;
import flowescrow.escrow.api.v1.dto.SetFeeRecipientRequest;
import flowescrow.escrow.api.v1.dto.SetFeeRequest;
import flowescrow.escrow.model.EscrowException;
import flowescrow.escrow.server.RouterHandler;
import flowescrow.escrow.service.EscrowService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Platform fee configuration.
 *
 * GET /api/v1/fee - Current fee and recipient
 * PUT /api/v1/fee - Change the fee (admin)
 * PUT /api/v1/fee/recipient - Change the fee recipient (admin)
 */
public class FeeController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(FeeController.class);

    private static final String FEE_PATH = "/api/v1/fee";
    private static final String RECIPIENT_PATH = "/api/v1/fee/recipient";

    private final EscrowService escrowService;

    public FeeController(EscrowService escrowService) {
        this.escrowService = escrowService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return FEE_PATH.equals(path);
        }
        if (method.equals(HttpMethod.PUT)) {
            return FEE_PATH.equals(path) || RECIPIENT_PATH.equals(path);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String caller = Controller.caller(req);
            if (req.method().equals(HttpMethod.PUT) && FEE_PATH.equals(path)) {
                SetFeeRequest request = RouterHandler.readBody(req, SetFeeRequest.class);
                request.validate();
                escrowService.setFee(caller, request.feeBps());
            } else if (req.method().equals(HttpMethod.PUT) && RECIPIENT_PATH.equals(path)) {
                SetFeeRecipientRequest request = RouterHandler.readBody(req, SetFeeRecipientRequest.class);
                escrowService.setFeeRecipient(caller, request.recipient());
            }
            return ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(FeeResponse.from(escrowService.feePolicy())));

        } catch (EscrowException e) {
            return ControllerResponse.rejected(e);
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed request body: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Fee controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
