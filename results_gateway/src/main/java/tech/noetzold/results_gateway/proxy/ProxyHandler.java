package tech.noetzold.results_gateway.proxy;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

@FunctionalInterface
public interface ProxyHandler {

    void handle(HttpServletRequest request, HttpServletResponse response) throws IOException;
}
