package io.bakky.app.config;

import io.bakky.persistence.jdbc.ConnectionParameters;
import io.bakky.persistence.jdbc.pool.PoolSettings;
import io.bakky.persistence.mongo.MongoSettings;
import io.bakky.persistence.redis.RedisSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "bakky")
public class BakkyProperties {
  private final App app = new App();
  private final Database database = new Database();
  private final Mongo mongo = new Mongo();
  private final Redis redis = new Redis();

  public App getApp() { return app; }
  public Database getDatabase() { return database; }
  public Mongo getMongo() { return mongo; }
  public Redis getRedis() { return redis; }

  public static class App {
    private String name = "bakky";
    private String version = "0.1.0";
    private String apiPrefix = "/api/v1";

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }
    public String getApiPrefix() { return apiPrefix; }
    public void setApiPrefix(String apiPrefix) { this.apiPrefix = apiPrefix; }
  }

  public static class Database {
    private String host = "localhost";
    private int port = 5432;
    private String name = "bakky";
    private String user = "postgres";
    private String password = "postgres";
    private String schema = ConnectionParameters.DEFAULT_SCHEMA;
    private String sslMode;
    private int poolSize = 10;
    private int maxOverflow = 20;
    private Duration poolRecycle = Duration.ofSeconds(3600);
    private Duration acquireTimeout = Duration.ofSeconds(30);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration statementTimeout = Duration.ZERO;
    private int asyncWorkers = 4;
    private Duration asyncTimeout = Duration.ofSeconds(60);

    /** Run the startup connection check and schema creation. */
    private boolean initialize = true;

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public String getSslMode() { return sslMode; }
    public void setSslMode(String sslMode) { this.sslMode = sslMode; }
    public int getPoolSize() { return poolSize; }
    public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
    public int getMaxOverflow() { return maxOverflow; }
    public void setMaxOverflow(int maxOverflow) { this.maxOverflow = maxOverflow; }
    public Duration getPoolRecycle() { return poolRecycle; }
    public void setPoolRecycle(Duration poolRecycle) { this.poolRecycle = poolRecycle; }
    public Duration getAcquireTimeout() { return acquireTimeout; }
    public void setAcquireTimeout(Duration acquireTimeout) { this.acquireTimeout = acquireTimeout; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    public Duration getStatementTimeout() { return statementTimeout; }
    public void setStatementTimeout(Duration statementTimeout) { this.statementTimeout = statementTimeout; }
    public int getAsyncWorkers() { return asyncWorkers; }
    public void setAsyncWorkers(int asyncWorkers) { this.asyncWorkers = asyncWorkers; }
    public Duration getAsyncTimeout() { return asyncTimeout; }
    public void setAsyncTimeout(Duration asyncTimeout) { this.asyncTimeout = asyncTimeout; }
    public boolean isInitialize() { return initialize; }
    public void setInitialize(boolean initialize) { this.initialize = initialize; }

    public ConnectionParameters toConnectionParameters() {
      return new ConnectionParameters(host, port, name, user, password, schema, sslMode, connectTimeout, statementTimeout);
    }

    public PoolSettings toPoolSettings() {
      return new PoolSettings(poolSize, maxOverflow, poolRecycle, acquireTimeout);
    }
  }

  public static class Mongo {
    private boolean enabled;
    private String uri = MongoSettings.DEFAULT_URI;
    private String database = "test_database";
    private String username;
    private String password;
    private int minPoolSize = 0;
    private int maxPoolSize = 100;
    private Duration maxIdleTime = Duration.ZERO;
    private Duration connectTimeout = Duration.ofMillis(20_000);
    private Duration socketTimeout = Duration.ofMillis(20_000);
    private Duration serverSelectionTimeout = Duration.ofMillis(30_000);
    private boolean retryWrites = true;
    private boolean retryReads = true;
    private boolean ssl;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public int getMinPoolSize() { return minPoolSize; }
    public void setMinPoolSize(int minPoolSize) { this.minPoolSize = minPoolSize; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
    public Duration getMaxIdleTime() { return maxIdleTime; }
    public void setMaxIdleTime(Duration maxIdleTime) { this.maxIdleTime = maxIdleTime; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    public Duration getSocketTimeout() { return socketTimeout; }
    public void setSocketTimeout(Duration socketTimeout) { this.socketTimeout = socketTimeout; }
    public Duration getServerSelectionTimeout() { return serverSelectionTimeout; }
    public void setServerSelectionTimeout(Duration serverSelectionTimeout) { this.serverSelectionTimeout = serverSelectionTimeout; }
    public boolean isRetryWrites() { return retryWrites; }
    public void setRetryWrites(boolean retryWrites) { this.retryWrites = retryWrites; }
    public boolean isRetryReads() { return retryReads; }
    public void setRetryReads(boolean retryReads) { this.retryReads = retryReads; }
    public boolean isSsl() { return ssl; }
    public void setSsl(boolean ssl) { this.ssl = ssl; }

    public MongoSettings toMongoSettings() {
      return new MongoSettings(uri, database, username, password, minPoolSize, maxPoolSize, maxIdleTime,
          connectTimeout, socketTimeout, serverSelectionTimeout, retryWrites, retryReads, ssl);
    }
  }

  public static class Redis {
    private boolean enabled;
    private String host = "localhost";
    private int port = RedisSettings.DEFAULT_PORT;
    private String username;
    private String password;
    private int database = 0;
    private boolean ssl;
    private Duration timeout = Duration.ofSeconds(2);
    private Duration expire = Duration.ofSeconds(3600);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public int getDatabase() { return database; }
    public void setDatabase(int database) { this.database = database; }
    public boolean isSsl() { return ssl; }
    public void setSsl(boolean ssl) { this.ssl = ssl; }
    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
    public Duration getExpire() { return expire; }
    public void setExpire(Duration expire) { this.expire = expire; }

    public RedisSettings toRedisSettings() {
      return new RedisSettings(host, port, username, password, database, ssl, timeout, expire);
    }
  }
}
