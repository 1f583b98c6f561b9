package io.intellixity.crudkit.web.json;

import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

/** Renders BSON value types found in stored documents: {@link ObjectId} as its hex string, {@link Decimal128} as text. */
public final class BsonJacksonModule extends SimpleModule {
  public BsonJacksonModule() {
    super("crudkit-bson");
    addSerializer(ObjectId.class, ToStringSerializer.instance);
    addSerializer(Decimal128.class, ToStringSerializer.instance);
  }
}
