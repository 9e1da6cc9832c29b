package win.ixuni.cloudreve.test;

import win.ixuni.cloudreve.core.util.JsonUtils;

/**
 * JSON fixtures of the {@code {code, msg, data}} envelope
 */
public final class Envelopes {

    private Envelopes() {
    }

    /**
     * @param dataJson raw JSON of the data field
     */
    public static String ok(String dataJson) {
        return "{\"code\":0,\"msg\":\"\",\"data\":" + dataJson + "}";
    }

    public static String ack() {
        return "{\"code\":0,\"msg\":\"\"}";
    }

    public static String error(int code, String msg) {
        return "{\"code\":" + code + ",\"msg\":" + JsonUtils.toJson(msg) + "}";
    }

    /**
     * JSON string literal, quoted and escaped
     */
    public static String quote(String value) {
        return JsonUtils.toJson(value);
    }
}
