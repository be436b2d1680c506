package flowescrow.escrow.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import flowescrow.escrow.api.Controller;
import flowescrow.escrow.api.v1.dto.BalanceResponse;
import flowescrow.escrow.api.v1.dto.MintRequest;
import flowescrow.escrow.model.EscrowException;
import flowescrow.escrow.server.RouterHandler;
import flowescrow.escrow.service.EscrowService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token wallets backing the escrow.
 *
 * GET /api/v1/balances/{account} - Wallet balance
 * POST /api/v1/balances/mint - Create tokens on a wallet (admin)
 */
public class BalanceController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(BalanceController.class);

    private static final Pattern BALANCE_PATTERN = Pattern.compile("^/api/v1/balances/([^/]+)$");
    private static final String MINT_PATH = "/api/v1/balances/mint";

    private final EscrowService escrowService;

    public BalanceController(EscrowService escrowService) {
        this.escrowService = escrowService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return MINT_PATH.equals(path);
        }
        return method.equals(HttpMethod.GET) && BALANCE_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST)) {
                return handleMint(req);
            }

            Matcher matcher = BALANCE_PATTERN.matcher(path);
            if (matcher.matches()) {
                String account = matcher.group(1);
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                        new BalanceResponse(account, escrowService.balanceOf(account))));
            }
            return ControllerResponse.notFound("unknown balance endpoint");

        } catch (EscrowException e) {
            return ControllerResponse.rejected(e);
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed request body: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Balance controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleMint(FullHttpRequest req) throws Exception {
        MintRequest request = RouterHandler.readBody(req, MintRequest.class);
        request.validate();
        escrowService.mintTokens(Controller.caller(req), request.account(), request.amount());

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                new BalanceResponse(request.account(), escrowService.balanceOf(request.account()))));
    }
}
