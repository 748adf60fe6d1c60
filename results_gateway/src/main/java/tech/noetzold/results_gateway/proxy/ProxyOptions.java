package tech.noetzold.results_gateway.proxy;

import java.util.List;

/**
 * Modifier chains applied around one proxied call, in list order.
 */
public record ProxyOptions(
        List<RequestModifier> requestModifiers,
        List<ResponseModifier> responseModifiers
) {

    public static ProxyOptions none() {
        return new ProxyOptions(List.of(), List.of());
    }

    public static ProxyOptions requestModifiers(RequestModifier... modifiers) {
        return new ProxyOptions(List.of(modifiers), List.of());
    }
}
