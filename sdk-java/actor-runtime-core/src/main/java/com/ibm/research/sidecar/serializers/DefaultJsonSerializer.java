/*
 * Copyright IBM Corporation 2024
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.ibm.research.sidecar.serializers;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.json.Json;
import javax.json.JsonArray;
import javax.json.JsonArrayBuilder;
import javax.json.JsonBuilderFactory;
import javax.json.JsonException;
import javax.json.JsonNumber;
import javax.json.JsonObject;
import javax.json.JsonObjectBuilder;
import javax.json.JsonReader;
import javax.json.JsonReaderFactory;
import javax.json.JsonString;
import javax.json.JsonValue;
import javax.json.JsonWriter;
import javax.json.JsonWriterFactory;

import com.ibm.research.sidecar.actor.ActorDurations;
import com.ibm.research.sidecar.actor.exceptions.SerializationException;

/**
 * JSON serializer built on JSON-P.
 *
 * Encodes JsonValues, strings, numbers, booleans, durations (in the sidecar's
 * duration format), maps with string keys, collections and arrays.
 * Decodes into JsonValue types, the matching Java scalars, Duration, Map,
 * List, or Object (a generic Map/List/String/BigDecimal/Boolean rendering).
 */
public class DefaultJsonSerializer implements Serializer {

	private static final JsonBuilderFactory factory = Json.createBuilderFactory(Map.of());
	private static final JsonReaderFactory readerFactory = Json.createReaderFactory(Map.of());
	private static final JsonWriterFactory writerFactory = Json.createWriterFactory(Map.of());

	@Override
	public byte[] serialize(Object obj) {
		JsonValue value = toJsonValue(obj);
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		try (JsonWriter writer = writerFactory.createWriter(out, StandardCharsets.UTF_8)) {
			writer.write(value);
		}
		return out.toByteArray();
	}

	@Override
	public <T> T deserialize(byte[] data, Class<T> type) {
		if (data == null || data.length == 0) {
			return null;
		}
		JsonValue value;
		try (JsonReader reader = readerFactory.createReader(new ByteArrayInputStream(data), StandardCharsets.UTF_8)) {
			value = reader.readValue();
		} catch (JsonException e) {
			throw new SerializationException("Malformed JSON: " + e.getMessage(), e);
		}
		return fromJsonValue(value, type);
	}

	/**
	 * Convert a Java value to a JsonValue.
	 */
	public static JsonValue toJsonValue(Object obj) {
		if (obj == null) {
			return JsonValue.NULL;
		} else if (obj instanceof JsonValue) {
			return (JsonValue) obj;
		} else if (obj instanceof CharSequence) {
			return Json.createValue(obj.toString());
		} else if (obj instanceof Boolean) {
			return ((Boolean) obj) ? JsonValue.TRUE : JsonValue.FALSE;
		} else if (obj instanceof Integer || obj instanceof Short || obj instanceof Byte) {
			return Json.createValue(((Number) obj).intValue());
		} else if (obj instanceof Long) {
			return Json.createValue((Long) obj);
		} else if (obj instanceof BigInteger) {
			return Json.createValue((BigInteger) obj);
		} else if (obj instanceof BigDecimal) {
			return Json.createValue((BigDecimal) obj);
		} else if (obj instanceof Number) {
			return Json.createValue(((Number) obj).doubleValue());
		} else if (obj instanceof Duration) {
			return Json.createValue(ActorDurations.format((Duration) obj));
		} else if (obj instanceof Map<?, ?>) {
			JsonObjectBuilder ob = factory.createObjectBuilder();
			for (Map.Entry<?, ?> e : ((Map<?, ?>) obj).entrySet()) {
				if (!(e.getKey() instanceof String)) {
					throw new SerializationException("Map keys must be strings: " + e.getKey());
				}
				ob.add((String) e.getKey(), toJsonValue(e.getValue()));
			}
			return ob.build();
		} else if (obj instanceof Collection<?>) {
			JsonArrayBuilder ab = factory.createArrayBuilder();
			for (Object o : (Collection<?>) obj) {
				ab.add(toJsonValue(o));
			}
			return ab.build();
		} else if (obj.getClass().isArray()) {
			JsonArrayBuilder ab = factory.createArrayBuilder();
			for (int i = 0; i < Array.getLength(obj); i++) {
				ab.add(toJsonValue(Array.get(obj, i)));
			}
			return ab.build();
		}
		throw new SerializationException("Cannot serialize " + obj.getClass().getName() + " as JSON");
	}

	@SuppressWarnings("unchecked")
	private static <T> T fromJsonValue(JsonValue value, Class<T> type) {
		Class<?> target = box(type);
		if (JsonValue.class.isAssignableFrom(target)) {
			if (value == JsonValue.NULL && target != JsonValue.class) {
				return null;
			}
			if (!target.isInstance(value)) {
				throw mismatch(value, type);
			}
			return (T) value;
		}
		if (value == JsonValue.NULL) {
			return null;
		}
		try {
			if (target == Object.class) {
				return (T) toJava(value);
			} else if (target == String.class) {
				return (T) ((JsonString) value).getString();
			} else if (target == Boolean.class) {
				if (value == JsonValue.TRUE || value == JsonValue.FALSE) {
					return (T) Boolean.valueOf(value == JsonValue.TRUE);
				}
				throw mismatch(value, type);
			} else if (target == Integer.class) {
				return (T) Integer.valueOf(((JsonNumber) value).intValueExact());
			} else if (target == Long.class) {
				return (T) Long.valueOf(((JsonNumber) value).longValueExact());
			} else if (target == Double.class) {
				return (T) Double.valueOf(((JsonNumber) value).doubleValue());
			} else if (target == BigDecimal.class) {
				return (T) ((JsonNumber) value).bigDecimalValue();
			} else if (target == Duration.class) {
				return (T) ActorDurations.parse(((JsonString) value).getString());
			} else if (target == Map.class || target == LinkedHashMap.class) {
				return (T) toJava((JsonObject) value);
			} else if (target == List.class || target == ArrayList.class || target == Collection.class) {
				return (T) toJava((JsonArray) value);
			}
		} catch (ClassCastException | ArithmeticException | IllegalArgumentException e) {
			throw new SerializationException("Cannot decode " + value.getValueType() + " as " + type.getName(), e);
		}
		throw new SerializationException("Unsupported target type " + type.getName());
	}

	private static Object toJava(JsonValue value) {
		switch (value.getValueType()) {
			case OBJECT:
				Map<String, Object> map = new LinkedHashMap<>();
				for (Map.Entry<String, JsonValue> e : ((JsonObject) value).entrySet()) {
					map.put(e.getKey(), toJava(e.getValue()));
				}
				return map;
			case ARRAY:
				List<Object> list = new ArrayList<>();
				for (JsonValue v : (JsonArray) value) {
					list.add(toJava(v));
				}
				return list;
			case STRING:
				return ((JsonString) value).getString();
			case NUMBER:
				return ((JsonNumber) value).bigDecimalValue();
			case TRUE:
				return Boolean.TRUE;
			case FALSE:
				return Boolean.FALSE;
			default:
				return null;
		}
	}

	private static SerializationException mismatch(JsonValue value, Class<?> type) {
		return new SerializationException("Cannot decode " + value.getValueType() + " as " + type.getName());
	}

	private static Class<?> box(Class<?> type) {
		if (!type.isPrimitive()) {
			return type;
		} else if (type == int.class) {
			return Integer.class;
		} else if (type == long.class) {
			return Long.class;
		} else if (type == double.class) {
			return Double.class;
		} else if (type == boolean.class) {
			return Boolean.class;
		}
		return type;
	}
}
