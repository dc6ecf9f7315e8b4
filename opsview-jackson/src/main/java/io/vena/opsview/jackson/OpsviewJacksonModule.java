package io.vena.opsview.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.ser.Serializers;
import io.vena.opsview.ConfigObjectMap;
import io.vena.opsview.ConfigRefMap;
import io.vena.opsview.KeyedMap;
import io.vena.opsview.UniquelyNamed;
import java.io.IOException;
import java.util.function.Supplier;

import static com.fasterxml.jackson.core.JsonToken.END_ARRAY;
import static com.fasterxml.jackson.core.JsonToken.START_ARRAY;

/**
 * Teaches Jackson about {@link ConfigObjectMap} and {@link ConfigRefMap}.
 *
 * <p>
 * Both are written as a plain JSON array of their values; the keys are never written
 * because they are always recomputed. Reading an array back re-derives every key
 * and fails with {@link DuplicateKeyException} if two elements compute the same one.
 */
public class OpsviewJacksonModule extends Module {

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(new KeyedMapSerializers());
		context.addDeserializers(new KeyedMapDeserializers());
	}

	/**
	 * An {@link ObjectMapper} set up the way the configuration service expects:
	 * unset fields omitted, unknown fields ignored.
	 */
	public static ObjectMapper newObjectMapper() {
		return new ObjectMapper()
			.registerModule(new OpsviewJacksonModule())
			.setSerializationInclusion(JsonInclude.Include.NON_NULL)
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
	}

	private static final class KeyedMapSerializers extends Serializers.Base {
		@Override
		public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
			if (KeyedMap.class.isAssignableFrom(type.getRawClass())) {
				return new JsonSerializer<KeyedMap<?>>() {
					@Override
					public void serialize(KeyedMap<?> value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
						gen.writeStartArray();
						for (Object entry : value) {
							serializers.defaultSerializeValue(entry, gen);
						}
						gen.writeEndArray();
					}
				};
			} else {
				return null;
			}
		}
	}

	private static final class KeyedMapDeserializers extends Deserializers.Base {
		@Override
		public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (ConfigObjectMap.class.isAssignableFrom(theClass)) {
				return keyedMapDeserializer(entryType(type), ConfigObjectMap::new);
			} else if (ConfigRefMap.class.isAssignableFrom(theClass)) {
				return keyedMapDeserializer(entryType(type), ConfigRefMap::new);
			} else {
				return null;
			}
		}

		@SuppressWarnings({"rawtypes", "unchecked"})
		private <M extends KeyedMap> JsonDeserializer<M> keyedMapDeserializer(JavaType entryType, Supplier<M> factory) {
			return new JsonDeserializer<M>() {
				@Override
				public M deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					JsonDeserializer<Object> valueDeserializer = ctxt.findRootValueDeserializer(entryType);
					M result = factory.get();
					expect(START_ARRAY, p);
					while (p.nextToken() != END_ARRAY) {
						UniquelyNamed value = (UniquelyNamed) valueDeserializer.deserialize(p, ctxt);
						if (value == null) {
							throw new JsonParseException(p, "Unexpected null entry");
						}
						String key = value.uniqueName();
						if (key == null) {
							throw JsonMappingException.from(p, "Entry has no unique name: " + value);
						}
						if (result.contains(key)) {
							throw new DuplicateKeyException(p, key);
						}
						result.add(value);
					}
					return result;
				}

				@Override
				public M getEmptyValue(DeserializationContext ctxt) {
					return factory.get();
				}

				@Override
				public boolean isCachable() {
					return true;
				}
			};
		}
	}

	private static JavaType entryType(JavaType keyedMapType) {
		return javaParameterType(keyedMapType, KeyedMap.class, 0);
	}

	private static JavaType javaParameterType(JavaType parameterizedType, Class<?> expectedClass, int index) {
		try {
			return parameterizedType.findTypeParameters(expectedClass)[index];
		} catch (IndexOutOfBoundsException e) {
			throw new IllegalStateException("Error computing javaParameterType(" + parameterizedType + ", " + expectedClass + ", " + index + ")");
		}
	}

	private static void expect(JsonToken expected, JsonParser p) throws IOException {
		if (p.currentToken() != expected) {
			throw new JsonParseException(p, "Expected " + expected);
		}
	}

}
