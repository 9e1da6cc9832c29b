package win.ixuni.cloudreve.driver.v3.handler.site;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.SiteConfig;
import win.ixuni.cloudreve.core.operation.site.GetSiteConfigOperation;
import win.ixuni.cloudreve.driver.v3.context.V3DriverContext;
import win.ixuni.cloudreve.driver.v3.handler.AbstractV3Handler;

import java.util.EnumSet;
import java.util.Set;

/**
 * V3 站点配置处理器
 * <p>
 * V3 has a single configuration object; the requested section is ignored.
 */
public class V3GetSiteConfigHandler extends AbstractV3Handler<GetSiteConfigOperation, SiteConfig> {

    @Override
    protected Mono<SiteConfig> doHandle(GetSiteConfigOperation operation, V3DriverContext context) {
        return context.getClient().siteConfig()
                .map(values -> new SiteConfig(ApiVersion.V3, null, values));
    }

    @Override
    public Class<GetSiteConfigOperation> getOperationType() {
        return GetSiteConfigOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.SITE);
    }
}
