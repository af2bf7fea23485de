package dev.plotrpc.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "plotrpc.rpc")
public class RpcProperties {

    /**
     * Register the {@code rpc.ping} and {@code rpc.echo} handlers.
     */
    private boolean diagnosticsEnabled = true;

    public boolean isDiagnosticsEnabled() {
        return diagnosticsEnabled;
    }

    public void setDiagnosticsEnabled(boolean diagnosticsEnabled) {
        this.diagnosticsEnabled = diagnosticsEnabled;
    }
}
