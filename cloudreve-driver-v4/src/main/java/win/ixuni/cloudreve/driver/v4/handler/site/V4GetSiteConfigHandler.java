package win.ixuni.cloudreve.driver.v4.handler.site;

import reactor.core.publisher.Mono;
import win.ixuni.cloudreve.core.driver.ApiVersion;
import win.ixuni.cloudreve.core.driver.DriverCapabilities.Capability;
import win.ixuni.cloudreve.core.model.SiteConfig;
import win.ixuni.cloudreve.core.operation.site.GetSiteConfigOperation;
import win.ixuni.cloudreve.driver.v4.context.V4DriverContext;
import win.ixuni.cloudreve.driver.v4.handler.AbstractV4Handler;

import java.util.EnumSet;
import java.util.Set;

/**
 * V4 站点配置，按 section 获取（默认 basic）
 */
public class V4GetSiteConfigHandler extends AbstractV4Handler<GetSiteConfigOperation, SiteConfig> {

    static final String DEFAULT_SECTION = "basic";

    @Override
    protected Mono<SiteConfig> doHandle(GetSiteConfigOperation operation, V4DriverContext context) {
        String section = operation.getSection() == null || operation.getSection().isBlank()
                ? DEFAULT_SECTION
                : operation.getSection();
        return context.getClient().siteConfig(section)
                .map(values -> new SiteConfig(ApiVersion.V4, section, values));
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
