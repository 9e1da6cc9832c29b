package win.ixuni.cloudreve.driver.v3;

import win.ixuni.cloudreve.core.config.DriverConfig;
import win.ixuni.cloudreve.test.FakeHttpTransport;

/**
 * V3 测试夹具
 */
public final class V3TestSupport {

    public static final String BASE_URL = "http://cloud.test";

    /**
     * Root listing with a file "a.txt" (X1) and a folder "b" (X2)
     */
    public static final String ROOT_LISTING = "{\"parent\":\"R0\",\"objects\":["
            + object("X1", "a.txt", "file", 12) + ","
            + object("X2", "b", "dir", 0)
            + "],\"policy\":{\"id\":\"P1\",\"name\":\"Default\",\"type\":\"local\",\"max_size\":0}}";

    private V3TestSupport() {
    }

    public static String object(String id, String name, String type, long size) {
        return "{\"id\":\"" + id + "\",\"name\":\"" + name + "\",\"path\":\"/\",\"thumb\":false,\"size\":" + size
                + ",\"type\":\"" + type + "\",\"date\":\"2024-01-02 10:00:00\",\"create_date\":\"2024-01-01 09:00:00\","
                + "\"source_enabled\":false}";
    }

    public static String listing(String policyType, String... objects) {
        return "{\"parent\":\"D1\",\"objects\":[" + String.join(",", objects) + "],"
                + "\"policy\":{\"id\":\"P9\",\"name\":\"p\",\"type\":\"" + policyType + "\",\"max_size\":0}}";
    }

    public static V3CloudreveDriver driver(FakeHttpTransport transport) {
        DriverConfig config = new DriverConfig();
        config.setName("v3-test");
        config.setType("v3");
        config.setBaseUrl(BASE_URL + "/");
        return new V3CloudreveDriver(config, transport);
    }
}
