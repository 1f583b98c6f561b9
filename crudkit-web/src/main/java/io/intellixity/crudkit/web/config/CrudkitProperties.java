package io.intellixity.crudkit.web.config;

import io.intellixity.crudkit.web.error.Environment;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "crudkit")
public class CrudkitProperties {
  /** Controls how much of a failure reaches the client; see {@link Environment}. */
  private Environment env = Environment.PRODUCTION;

  /** Hand failures to the exception-handler chain instead of formatting them in the responder. */
  private boolean useNext = true;

  private int defaultPageSize = 10;
  private int fanOutThreads = 4;
  private final Mongo mongo = new Mongo();
  private final Map<String, Model> models = new LinkedHashMap<>();

  public Environment getEnv() { return env; }
  public void setEnv(Environment env) { this.env = env; }
  public boolean isUseNext() { return useNext; }
  public void setUseNext(boolean useNext) { this.useNext = useNext; }
  public int getDefaultPageSize() { return defaultPageSize; }
  public void setDefaultPageSize(int defaultPageSize) { this.defaultPageSize = defaultPageSize; }
  public int getFanOutThreads() { return fanOutThreads; }
  public void setFanOutThreads(int fanOutThreads) { this.fanOutThreads = fanOutThreads; }
  public Mongo getMongo() { return mongo; }
  public Map<String, Model> getModels() { return models; }

  public static class Mongo {
    private String uri = "mongodb://localhost:27017";
    private String database = "crudkit";

    /** Multi-document transactions for createMany; needs a replica set. */
    private boolean transactional;

    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
    public boolean isTransactional() { return transactional; }
    public void setTransactional(boolean transactional) { this.transactional = transactional; }
  }

  public static class Model {
    /** Defaults to the model name. */
    private String collection;

    /** Select string of fields never returned, e.g. {@code "-password -__v"}. */
    private String exempt;

    /** Path to referenced collection. Dotted keys need brackets in YAML: {@code "[author.company]"}. */
    private final Map<String, String> relations = new LinkedHashMap<>();

    public String getCollection() { return collection; }
    public void setCollection(String collection) { this.collection = collection; }
    public String getExempt() { return exempt; }
    public void setExempt(String exempt) { this.exempt = exempt; }
    public Map<String, String> getRelations() { return relations; }
  }
}
