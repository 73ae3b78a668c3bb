package cloud.fleethub.sdk.auth;

import cloud.fleethub.sdk.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Base64;

/**
 * Claims read from the payload segment of an access token. The signature is not verified; the values only
 * describe which workspace and account the issuer bound the token to.
 */
public record DecodedClaims(
    String workspaceId,
    String workspaceName,
    String accountId,
    long expiresAtUnix
) {

    public static DecodedClaims decode(String token) {
        if (token == null) {
            return empty();
        }
        try {
            String[] parts = token.split("\\.");
            if (parts.length < 2) {
                return empty();
            }

            byte[] payload = decodeBase64(parts[1]);
            JsonNode node = Json.mapper().readTree(payload);

            String account = Json.text(node, "account_id");
            if (account == null) {
                account = Json.text(node, "sub");
            }

            return new DecodedClaims(
                Json.text(node, "workspace_id"),
                Json.text(node, "workspace_name"),
                account,
                node.path("exp").isNumber() ? node.path("exp").asLong(0L) : 0L
            );
        } catch (IOException | IllegalArgumentException ex) {
            return empty();
        }
    }

    private static byte[] decodeBase64(String value) {
        try {
            return Base64.getUrlDecoder().decode(value);
        } catch (IllegalArgumentException ex) {
            return Base64.getDecoder().decode(value);
        }
    }

    private static DecodedClaims empty() {
        return new DecodedClaims(null, null, null, 0L);
    }
}
