package win.ixuni.cloudreve.driver.v4.handler.site;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.site.PingOperation;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.EnumSet;
import java.util.Set;

public class V4PingHandler extends AbstractV4Handler<PingOperation, String> {

    @Override
    protected Mono<String> doHandle(PingOperation operation, V4DriverContext context) {
        return context.getClient().ping();
    }

    @Override
    public Class<PingOperation> getOperationType() {
        return PingOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.SITE);
    }
}
