package works.graphstate.json;

import java.util.Map;
import org.jetbrains.annotations.Nullable;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;
import works.graphstate.exceptions.StateSerializationException;

import static java.util.Objects.requireNonNull;

/**
 * Converts the opaque {@code state} and {@code metadata} payloads
 * to and from the forms the backends store.
 * <p>
 * Only the top level is checked: it must be a JSON object.
 * Everything beneath is carried through untouched.
 */
public final class StateJson {
	private final ObjectMapper mapper;

	public StateJson() {
		this(JsonMapper.builder().build());
	}

	public StateJson(ObjectMapper mapper) {
		this.mapper = requireNonNull(mapper);
	}

	public ObjectMapper mapper() {
		return mapper;
	}

	public ObjectNode newObject() {
		return mapper.createObjectNode();
	}

	public String write(ObjectNode node) {
		try {
			return mapper.writeValueAsString(node);
		} catch (JacksonException e) {
			throw new StateSerializationException("Unable to serialize JSON object", e);
		}
	}

	public @Nullable String writeNullable(@Nullable ObjectNode node) {
		return (node == null) ? null : write(node);
	}

	/**
	 * @param what describes the payload for error messages, like {@code "state"}
	 * @throws StateSerializationException if {@code json} is not a JSON object
	 */
	public ObjectNode read(String json, String what) {
		JsonNode node;
		try {
			node = mapper.readTree(json);
		} catch (JacksonException e) {
			throw new StateSerializationException("Stored " + what + " is not valid JSON", e);
		}
		return requireObject(node, what);
	}

	public @Nullable ObjectNode readNullable(@Nullable String json, String what) {
		return (json == null) ? null : read(json, what);
	}

	/**
	 * For backends whose client libraries hand us plain Java maps and lists.
	 */
	public ObjectNode fromMap(Map<String, ?> map, String what) {
		return requireNonNull(fromValue(requireNonNull(map), what));
	}

	/**
	 * Accepts any value the caller's JSON library or client library produced;
	 * anything other than a map is reported as a corrupt {@code what}.
	 */
	public @Nullable ObjectNode fromValue(@Nullable Object value, String what) {
		if (value == null) {
			return null;
		} else if (value instanceof Map<?, ?> map) {
			try {
				return requireObject(mapper.valueToTree(map), what);
			} catch (JacksonException | IllegalArgumentException e) {
				throw new StateSerializationException("Stored " + what + " cannot be represented as JSON", e);
			}
		} else {
			throw new StateSerializationException("Stored " + what + " is not a JSON object: " + value.getClass().getSimpleName());
		}
	}

	public Map<String, Object> toMap(ObjectNode node) {
		try {
			return mapper.convertValue(node, MAP_TYPE);
		} catch (JacksonException | IllegalArgumentException e) {
			throw new StateSerializationException("Unable to convert JSON object", e);
		}
	}

	private static ObjectNode requireObject(JsonNode node, String what) {
		if (node instanceof ObjectNode object) {
			return object;
		} else {
			throw new StateSerializationException("Stored " + what + " is not a JSON object: " + (node == null ? "null" : node.getNodeType()));
		}
	}

	private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };
}
