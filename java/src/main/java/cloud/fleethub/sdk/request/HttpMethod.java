package cloud.fleethub.sdk.request;

/**
 * HTTP methods accepted by the transport boundary.
 */
public enum HttpMethod {
    GET(BodyRule.FORBIDDEN),
    HEAD(BodyRule.FORBIDDEN),
    POST(BodyRule.REQUIRED),
    PUT(BodyRule.REQUIRED),
    PATCH(BodyRule.REQUIRED),
    DELETE(BodyRule.OPTIONAL);

    enum BodyRule {
        REQUIRED,
        OPTIONAL,
        FORBIDDEN
    }

    private final BodyRule bodyRule;

    HttpMethod(BodyRule bodyRule) {
        this.bodyRule = bodyRule;
    }

    public boolean requiresBody() {
        return bodyRule == BodyRule.REQUIRED;
    }

    public boolean permitsBody() {
        return bodyRule != BodyRule.FORBIDDEN;
    }
}
