package flowescrow.escrow.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import flowescrow.escrow.api.Controller;
import flowescrow.escrow.api.v1.dto.RoleRequest;
import flowescrow.escrow.model.EscrowException;
import flowescrow.escrow.model.Role;
import flowescrow.escrow.server.RouterHandler;
import flowescrow.escrow.service.EscrowService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Role administration.
 *
 * POST /api/v1/roles/grant - Grant a role (caller needs the role's admin role)
 * POST /api/v1/roles/revoke - Revoke a role
 * GET /api/v1/roles/admins/{account} - Whether the account is a platform admin
 * GET /api/v1/roles/{role}/members - Holders of a role
 */
public class RoleController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(RoleController.class);

    private static final Pattern CHANGE_PATTERN = Pattern.compile("^/api/v1/roles/(grant|revoke)$");
    private static final Pattern IS_ADMIN_PATTERN = Pattern.compile("^/api/v1/roles/admins/([^/]+)$");
    private static final Pattern MEMBERS_PATTERN = Pattern.compile("^/api/v1/roles/([A-Za-z_]+)/members$");

    private final EscrowService escrowService;

    public RoleController(EscrowService escrowService) {
        this.escrowService = escrowService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return CHANGE_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return IS_ADMIN_PATTERN.matcher(path).matches() || MEMBERS_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher change = CHANGE_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.POST) && change.matches()) {
                RoleRequest request = RouterHandler.readBody(req, RoleRequest.class);
                Role role = request.parsedRole();
                String caller = Controller.caller(req);
                boolean changed = "grant".equals(change.group(1))
                        ? escrowService.grantRole(caller, role, request.account())
                        : escrowService.revokeRole(caller, role, request.account());

                Map<String, Object> response = new LinkedHashMap<>();
                response.put("role", role.name());
                response.put("account", request.account());
                response.put("changed", changed);
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
            }

            Matcher isAdmin = IS_ADMIN_PATTERN.matcher(path);
            if (isAdmin.matches()) {
                String account = isAdmin.group(1);
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                        Map.of("account", account, "admin", escrowService.isAdmin(account))));
            }

            Matcher members = MEMBERS_PATTERN.matcher(path);
            if (members.matches()) {
                Role role = new RoleRequest(members.group(1), null).parsedRole();
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                        Map.of("role", role.name(), "members", escrowService.roleMembers(role))));
            }

            return ControllerResponse.notFound("unknown role endpoint");

        } catch (EscrowException e) {
            return ControllerResponse.rejected(e);
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed request body: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Role controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
