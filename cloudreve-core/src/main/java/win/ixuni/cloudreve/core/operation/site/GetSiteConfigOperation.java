package win.ixuni.cloudreve.core.operation.site;

import lombok.Value;
import win.ixuni.cloudreve.core.model.SiteConfig;
import win.ixuni.cloudreve.core.operation.Operation;

/**
 * 获取站点配置
 */
@Value
public class GetSiteConfigOperation implements Operation<SiteConfig> {

    /**
     * V4 config section (basic, login, explorer, ...); null means basic
     */
    String section;
}
