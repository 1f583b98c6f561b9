package io.intellixity.crudkit.mongo;

import com.mongodb.client.MongoClient;

import java.util.Objects;

/**
 * Client + database pair a {@link MongoDocumentStore} runs against.\n
 *
 * {@code transactional} enables multi-document transactions for {@code createMany}; it requires a
 * replica set or sharded cluster.\n
 */
public final class MongoHandle {
  private final String id;
  private final MongoClient client;
  private final String database;
  private final boolean transactional;

  public MongoHandle(String id, MongoClient client, String database, boolean transactional) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.database = Objects.requireNonNull(database, "database");
    this.transactional = transactional;
  }

  public String id() { return id; }
  public MongoClient client() { return client; }
  public String database() { return database; }
  public boolean transactional() { return transactional; }
}
