package cc.whohow.objects.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

@Configuration
public class RedisObjectsConfiguration {
    public static final String REDIS_PROPERTIES = "redis.properties";
    public static final String URI = "uri";
    public static final String DEFAULT_URI = "redis://localhost:6379";

    public static RedisURI redisURI(Properties properties) {
        return RedisURI.create(properties.getProperty(URI, DEFAULT_URI));
    }

    /**
     * Read {@code redis.properties} from the working directory, falling back to the classpath.
     * Missing everywhere means an empty set of properties.
     */
    public static Properties loadProperties() {
        Properties properties = new Properties();
        Path path = Paths.get(REDIS_PROPERTIES);
        try {
            if (Files.isRegularFile(path)) {
                try (Reader reader = Files.newBufferedReader(path)) {
                    properties.load(reader);
                }
            } else {
                try (InputStream stream = RedisObjectsConfiguration.class.getClassLoader().getResourceAsStream(REDIS_PROPERTIES)) {
                    if (stream != null) {
                        properties.load(stream);
                    }
                }
            }
            return properties;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public RedisURI redisURI() {
        return redisURI(loadProperties());
    }

    @Bean(destroyMethod = "shutdown")
    public RedisClient redisClient() {
        return RedisClient.create();
    }

    @Bean(destroyMethod = "close")
    public Redis redis(@Autowired RedisClient redisClient, @Autowired RedisURI redisURI) {
        return new StandaloneRedis(redisClient, redisURI);
    }

    @Bean
    public RedisObjects redisObjects(@Autowired Redis redis, @Autowired ObjectMapper objectMapper) {
        return new RedisObjects(redis, objectMapper);
    }
}
