package dev.plotrpc.server;

import dev.plotrpc.rpc.JsonRpc;
import dev.plotrpc.server.config.RpcProperties;
import dev.plotrpc.server.config.TransportProperties;
import dev.plotrpc.server.transport.TcpAcceptor;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties({TransportProperties.class, RpcProperties.class})
public class RpcServerApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(RpcServerApplication.class);

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(RpcServerApplication.class, args);
        TcpAcceptor acceptor = context.getBean(TcpAcceptor.class);
        // Endpoint threads are daemons; keep the JVM up until the context shuts the acceptor down.
        while (context.isActive() && !acceptor.isStopped()) {
            acceptor.waitConnection(Duration.ofSeconds(5));
            acceptor.waitUntilNoClient(Duration.ofSeconds(5));
        }
    }

    @Bean(destroyMethod = "stop")
    TcpAcceptor tcpAcceptor(TransportProperties transportProperties) {
        TcpAcceptor acceptor = new TcpAcceptor("rpc-server", transportProperties.getMaxFrameSize());
        if (!acceptor.serve(transportProperties.getAddress(), transportProperties.getPort())) {
            throw new IllegalStateException("Unable to listen on port " + transportProperties.getPort());
        }
        LOGGER.info("RPC server listening on port {}", acceptor.getPort());
        return acceptor;
    }

    @Bean(destroyMethod = "close")
    JsonRpc jsonRpc(TcpAcceptor tcpAcceptor, RpcProperties rpcProperties) {
        JsonRpc rpc = new JsonRpc(tcpAcceptor);
        if (rpcProperties.isDiagnosticsEnabled()) {
            DiagnosticHandlers.register(rpc);
        }
        return rpc;
    }
}
