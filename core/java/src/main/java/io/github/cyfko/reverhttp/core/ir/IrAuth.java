package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Authentication requirements.
 *
 * @param method      authentication scheme such as {@code bearer}, {@code api-key} or {@code basic};
 *                    always written, possibly empty
 * @param roles       required roles
 * @param permissions required permissions
 * @param bind        variable receiving the authenticated principal
 */
@JsonPropertyOrder({"method", "roles", "permissions", "bind"})
public record IrAuth(
        String method,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> roles,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> permissions,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) String bind) {

    public IrAuth {
        method = method == null ? "" : method;
        roles = Copies.list(roles);
        permissions = Copies.list(permissions);
    }
}
