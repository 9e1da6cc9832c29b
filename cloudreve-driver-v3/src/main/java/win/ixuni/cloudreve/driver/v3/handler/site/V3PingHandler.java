package win.ixuni.cloudreve.driver.v3.handler.site;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.operation.site.PingOperation;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;

import java.util.EnumSet;
import java.util.Set;

public class V3PingHandler extends AbstractV3Handler<PingOperation, String> {

    @Override
    protected Mono<String> doHandle(PingOperation operation, V3DriverContext context) {
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
