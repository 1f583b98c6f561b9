package io.intellixity.crudkit.web.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.crudkit.exec.CrudService;
import io.intellixity.crudkit.mongo.MongoDocumentStore;
import io.intellixity.crudkit.mongo.MongoHandle;
import io.intellixity.crudkit.service.CrudSettings;
import io.intellixity.crudkit.service.DefaultCrudService;
import io.intellixity.crudkit.store.DocumentStore;
import io.intellixity.crudkit.web.error.ErrorNormalizer;
import io.intellixity.crudkit.web.http.CrudResponder;
import io.intellixity.crudkit.web.http.ModelRegistry;
import io.intellixity.crudkit.web.json.BsonJacksonModule;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(CrudkitProperties.class)
public class CrudkitConfig {

  @Bean(destroyMethod = "close")
  public MongoClient mongoClient(CrudkitProperties props) {
    return MongoClients.create(props.getMongo().getUri());
  }

  @Bean
  public MongoHandle mongoHandle(MongoClient client, CrudkitProperties props) {
    CrudkitProperties.Mongo m = props.getMongo();
    return new MongoHandle("mongo:" + m.getDatabase(), client, m.getDatabase(), m.isTransactional());
  }

  @Bean
  public DocumentStore documentStore(MongoHandle handle) {
    return new MongoDocumentStore(handle);
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService crudFanOutExecutor(CrudkitProperties props) {
    AtomicInteger n = new AtomicInteger();
    return Executors.newFixedThreadPool(Math.max(1, props.getFanOutThreads()), r -> {
      Thread t = new Thread(r, "crudkit-fanout-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  @Bean
  public CrudService crudService(DocumentStore store, ExecutorService crudFanOutExecutor,
                                 CrudkitProperties props, ObjectMapper mapper) {
    return new DefaultCrudService(store, new CrudSettings(props.getDefaultPageSize()), crudFanOutExecutor, mapper);
  }

  @Bean
  public ModelRegistry modelRegistry(CrudkitProperties props) {
    return ModelRegistry.from(props.getModels());
  }

  @Bean
  public ErrorNormalizer errorNormalizer(CrudkitProperties props) {
    return new ErrorNormalizer(props.getEnv());
  }

  @Bean
  public CrudResponder crudResponder(ErrorNormalizer normalizer, CrudkitProperties props) {
    return new CrudResponder(normalizer, props.isUseNext());
  }

  // picked up by Spring Boot's Jackson auto-configuration
  @Bean
  public BsonJacksonModule bsonJacksonModule() {
    return new BsonJacksonModule();
  }
}
