package tech.noetzold.results_gateway.proxy;

@FunctionalInterface
public interface ResponseModifier {

    ProxyResponse modify(ProxyResponse response);
}
