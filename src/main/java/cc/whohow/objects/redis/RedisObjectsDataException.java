package cc.whohow.objects.redis;

/**
 * A value stored in Redis could not be decoded as JSON of the accessor's value type.
 */
public class RedisObjectsDataException extends RuntimeException {
    private final String key;
    private final String raw;

    public RedisObjectsDataException(String key, String raw, Throwable cause) {
        super("invalid JSON at " + key + ": " + raw, cause);
        this.key = key;
        this.raw = raw;
    }

    public String getKey() {
        return key;
    }

    public String getRaw() {
        return raw;
    }
}
