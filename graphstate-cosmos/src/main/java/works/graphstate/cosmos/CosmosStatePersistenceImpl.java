package works.graphstate.cosmos;

import com.azure.cosmos.ConsistencyLevel;
import com.azure.cosmos.CosmosClient;
import com.azure.cosmos.CosmosClientBuilder;
import com.azure.cosmos.CosmosContainer;
import com.azure.cosmos.CosmosDatabase;
import com.azure.cosmos.CosmosEndToEndOperationLatencyPolicyConfigBuilder;
import com.azure.cosmos.CosmosException;
import com.azure.cosmos.GatewayConnectionConfig;
import com.azure.cosmos.models.CompositePath;
import com.azure.cosmos.models.CompositePathSortOrder;
import com.azure.cosmos.models.CosmosContainerProperties;
import com.azure.cosmos.models.CosmosItemRequestOptions;
import com.azure.cosmos.models.CosmosItemResponse;
import com.azure.cosmos.models.CosmosPatchOperations;
import com.azure.cosmos.models.CosmosQueryRequestOptions;
import com.azure.cosmos.models.ExcludedPath;
import com.azure.cosmos.models.IncludedPath;
import com.azure.cosmos.models.IndexingMode;
import com.azure.cosmos.models.IndexingPolicy;
import com.azure.cosmos.models.PartitionKey;
import com.azure.cosmos.models.SqlParameter;
import com.azure.cosmos.models.SqlQuerySpec;
import com.azure.cosmos.models.ThroughputProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.node.ObjectNode;
import works.graphstate.PersistenceSettings;
import works.graphstate.StateDocument;
import works.graphstate.exceptions.BackendConnectionException;
import works.graphstate.exceptions.PersistenceTimeoutException;
import works.graphstate.exceptions.StatePersistenceException;
import works.graphstate.exceptions.StateSerializationException;
import works.graphstate.json.StateJson;
import works.graphstate.util.Arguments;
import works.graphstate.util.Lifecycle;
import works.graphstate.util.Lifecycle.Phase;

import static java.util.Objects.requireNonNull;
import static works.graphstate.logging.MappedDiagnosticContext.MDCScope;
import static works.graphstate.logging.MappedDiagnosticContext.setupMDC;
import static works.graphstate.util.Timestamps.format;
import static works.graphstate.util.Timestamps.now;
import static works.graphstate.util.Timestamps.parse;

class CosmosStatePersistenceImpl implements CosmosStatePersistence {
	private final PersistenceSettings settings;
	private final CosmosSettings cosmosSettings;
	private final CosmosConnectionInfo connectionInfo;
	private final String instanceID = UUID.randomUUID().toString();
	private final StateJson json = new StateJson();
	private final Lifecycle lifecycle;

	private volatile CosmosClient client;
	private volatile CosmosContainer container;

	CosmosStatePersistenceImpl(PersistenceSettings settings, CosmosSettings cosmosSettings, CosmosConnectionInfo connectionInfo) {
		this.settings = requireNonNull(settings);
		this.cosmosSettings = requireNonNull(cosmosSettings);
		this.connectionInfo = requireNonNull(connectionInfo);
		this.lifecycle = new Lifecycle("CosmosStatePersistence " + instanceID);
	}

	@Override
	public String backend() {
		return BACKEND;
	}

	@Override
	public String instanceID() {
		return instanceID;
	}

	@Override
	public synchronized void initialize() {
		lifecycle.checkNotClosed();
		try (MDCScope __ = setupMDC(BACKEND, instanceID)) {
			if (client == null) {
				LOGGER.debug("Opening client for {}", connectionInfo);
				client = createClient();
			}
			try {
				client.createDatabaseIfNotExists(cosmosSettings.database());
				CosmosDatabase database = client.getDatabase(cosmosSettings.database());
				database.createContainerIfNotExists(
					containerProperties(),
					ThroughputProperties.createManualThroughput(cosmosSettings.throughput()));
				container = database.getContainer(settings.tableName());
			} catch (CosmosException e) {
				throw new BackendConnectionException("Unable to create container \"" + containerDescription() + "\"", e);
			}
			lifecycle.markInitialized();
			LOGGER.info("Initialized Cosmos DB container \"{}\"", containerDescription());
		}
	}

	private CosmosClient createClient() {
		CosmosClientBuilder builder = new CosmosClientBuilder()
			.endpoint(connectionInfo.endpoint())
			.key(connectionInfo.key())
			.consistencyLevel(ConsistencyLevel.SESSION)
			.userAgentSuffix("graphstate")
			.endToEndOperationLatencyPolicyConfig(
				new CosmosEndToEndOperationLatencyPolicyConfigBuilder(Duration.ofMillis(settings.operationTimeoutMS()))
					.enable(true)
					.build());
		if (cosmosSettings.gatewayMode()) {
			GatewayConnectionConfig gateway = new GatewayConnectionConfig();
			gateway.setMaxConnectionPoolSize(settings.maxPoolSize());
			builder.gatewayMode(gateway);
		} else {
			builder.directMode();
		}
		try {
			return builder.buildClient();
		} catch (RuntimeException e) {
			// The builder contacts the account to read its topology, and reports failure however it likes
			throw new BackendConnectionException("Unable to connect to Cosmos DB at " + connectionInfo.endpoint(), e);
		}
	}

	private CosmosContainerProperties containerProperties() {
		IndexingPolicy indexing = new IndexingPolicy();
		indexing.setIndexingMode(IndexingMode.CONSISTENT);
		indexing.setIncludedPaths(List.of(new IncludedPath("/*")));
		indexing.setExcludedPaths(List.of(
			new ExcludedPath("/" + STATE + "/*"),
			new ExcludedPath("/" + METADATA + "/*"),
			new ExcludedPath("/\"_etag\"/?")));
		indexing.setCompositeIndexes(List.of(List.of(
			new CompositePath().setPath("/" + CREATED_AT).setOrder(CompositePathSortOrder.DESCENDING),
			new CompositePath().setPath("/" + ID).setOrder(CompositePathSortOrder.DESCENDING))));
		CosmosContainerProperties properties = new CosmosContainerProperties(settings.tableName(), "/" + THREAD_ID);
		properties.setIndexingPolicy(indexing);
		return properties;
	}

	@Override
	public boolean saveState(String threadId, String checkpointId, ObjectNode state, @Nullable ObjectNode metadata) {
		Arguments.threadId(threadId);
		Arguments.checkpointId(checkpointId);
		Arguments.state(state);
		try (
			var __ = lifecycle.begin("saveState");
			MDCScope ___ = setupMDC(BACKEND, instanceID, threadId)
		) {
			LOGGER.debug("saveState({}, {})", threadId, checkpointId);
			Map<String, Object> stateMap, metadataMap;
			try {
				stateMap = json.toMap(state);
				metadataMap = (metadata == null) ? null : json.toMap(metadata);
			} catch (StateSerializationException e) {
				LOGGER.warn("Checkpoint {} not saved: unable to serialize", checkpointId, e);
				return false;
			}
			String timestamp = format(now(settings.clock()));
			String id = documentID(threadId, checkpointId);
			PartitionKey partitionKey = new PartitionKey(threadId);
			try {
				for (int attempt = 0; attempt <= cosmosSettings.maxConflictRetries(); attempt++) {
					if (attempt > 0) {
						LOGGER.debug("Checkpoint {} deleted while being overwritten; retry #{}", checkpointId, attempt);
					}
					if (tryCreate(newDocument(id, threadId, checkpointId, stateMap, metadataMap, timestamp, timestamp), partitionKey)) {
						return true;
					}
					if (tryPatch(id, partitionKey, stateMap, metadataMap, timestamp)) {
						return true;
					}
				}
				LOGGER.warn("Checkpoint {} not saved: deleted concurrently {} times in a row", checkpointId, cosmosSettings.maxConflictRetries() + 1);
				return false;
			} catch (CosmosException e) {
				LOGGER.warn("Checkpoint {} not saved", checkpointId, translate("saveState", e));
				return false;
			}
		}
	}

	/**
	 * @return false if someone else created the document first
	 */
	private boolean tryCreate(Map<String, Object> document, PartitionKey partitionKey) {
		try {
			activeContainer().createItem(document, partitionKey, new CosmosItemRequestOptions());
			LOGGER.debug("Created document {}", document.get(ID));
			return true;
		} catch (CosmosException e) {
			if (e.getStatusCode() == CONFLICT) {
				return false;
			}
			throw e;
		}
	}

	/**
	 * Overwrites the mutable fields of an existing document in one server-side operation,
	 * leaving {@code created_at} as it was.
	 *
	 * @return false if the document no longer exists
	 */
	private boolean tryPatch(String id, PartitionKey partitionKey, Map<String, Object> stateMap, @Nullable Map<String, Object> metadataMap, String timestamp) {
		CosmosPatchOperations operations = CosmosPatchOperations.create()
			.set("/" + STATE, stateMap)
			.set("/" + METADATA, metadataMap)
			.set("/" + UPDATED_AT, timestamp);
		try {
			activeContainer().patchItem(id, partitionKey, operations, DOCUMENT_TYPE);
			LOGGER.debug("Patched document {}", id);
			return true;
		} catch (CosmosException e) {
			if (e.getStatusCode() == NOT_FOUND) {
				return false;
			}
			throw e;
		}
	}

	@Override
	public Optional<StateDocument> loadState(String threadId, @Nullable String checkpointId) {
		Arguments.threadId(threadId);
		Arguments.optionalCheckpointId(checkpointId);
		try (
			var __ = lifecycle.begin("loadState");
			MDCScope ___ = setupMDC(BACKEND, instanceID, threadId)
		) {
			LOGGER.debug("loadState({}, {})", threadId, checkpointId);
			try {
				if (checkpointId == null) {
					return newest(threadId, 1).stream()
						.findFirst()
						.map(this::toDocument);
				} else {
					return readItem(documentID(threadId, checkpointId), new PartitionKey(threadId))
						.map(response -> toDocument(response.getItem()));
				}
			} catch (CosmosException e) {
				throw translate("loadState", e);
			}
		}
	}

	@Override
	public List<StateDocument> listCheckpoints(String threadId, int limit) {
		Arguments.threadId(threadId);
		Arguments.limit(limit);
		try (
			var __ = lifecycle.begin("listCheckpoints");
			MDCScope ___ = setupMDC(BACKEND, instanceID, threadId)
		) {
			LOGGER.debug("listCheckpoints({}, {})", threadId, limit);
			if (limit == 0) {
				return List.of();
			}
			try {
				return newest(threadId, limit).stream()
					.map(this::toDocument)
					.toList();
			} catch (CosmosException e) {
				throw translate("listCheckpoints", e);
			}
		}
	}

	@Override
	public boolean deleteState(String threadId, @Nullable String checkpointId) {
		Arguments.threadId(threadId);
		Arguments.optionalCheckpointId(checkpointId);
		try (
			var __ = lifecycle.begin("deleteState");
			MDCScope ___ = setupMDC(BACKEND, instanceID, threadId)
		) {
			LOGGER.debug("deleteState({}, {})", threadId, checkpointId);
			PartitionKey partitionKey = new PartitionKey(threadId);
			try {
				int deleted = 0;
				if (checkpointId == null) {
					SqlQuerySpec query = new SqlQuerySpec(
						"SELECT c.id FROM c WHERE c.thread_id = @threadId",
						List.of(new SqlParameter("@threadId", threadId)));
					List<Map<String, Object>> ids = activeContainer()
						.queryItems(query, new CosmosQueryRequestOptions().setPartitionKey(partitionKey), DOCUMENT_TYPE)
						.stream()
						.toList();
					for (Map<String, Object> item: ids) {
						if (deleteItem((String) item.get(ID), partitionKey)) {
							++deleted;
						}
					}
				} else if (deleteItem(documentID(threadId, checkpointId), partitionKey)) {
					++deleted;
				}
				LOGGER.debug("Deleted {} document(s)", deleted);
				return true;
			} catch (CosmosException e) {
				LOGGER.warn("Checkpoints not deleted", translate("deleteState", e));
				return false;
			}
		}
	}

	/**
	 * @return false if there was nothing to delete
	 */
	private boolean deleteItem(String id, PartitionKey partitionKey) {
		try {
			activeContainer().deleteItem(id, partitionKey, new CosmosItemRequestOptions());
			return true;
		} catch (CosmosException e) {
			if (e.getStatusCode() == NOT_FOUND) {
				return false;
			}
			throw e;
		}
	}

	@Override
	public synchronized void close() {
		Phase previous = lifecycle.beginClose();
		if (previous == Phase.CLOSED) {
			return;
		}
		try (MDCScope __ = setupMDC(BACKEND, instanceID)) {
			LOGGER.debug("Closing");
			try {
				if (!lifecycle.awaitQuiescence(settings.closeTimeoutMS())) {
					LOGGER.warn("Closing client with {} operation(s) still in flight", lifecycle.inFlight());
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				LOGGER.debug("Interrupted while waiting for operations to finish", e);
			}
			CosmosClient c = client;
			container = null;
			if (c != null) {
				client = null;
				c.close();
			}
		}
	}

	/**
	 * For tests.
	 */
	void deleteContainer() {
		try {
			activeContainer().delete();
		} catch (CosmosException e) {
			throw new BackendConnectionException("Unable to delete container \"" + containerDescription() + "\"", e);
		}
	}

	private List<Map<String, Object>> newest(String threadId, int limit) {
		SqlQuerySpec query = new SqlQuerySpec(
			"SELECT TOP @limit * FROM c WHERE c.thread_id = @threadId ORDER BY c.created_at DESC, c.id DESC",
			List.of(
				new SqlParameter("@limit", limit),
				new SqlParameter("@threadId", threadId)));
		return activeContainer()
			.queryItems(query, new CosmosQueryRequestOptions().setPartitionKey(new PartitionKey(threadId)), DOCUMENT_TYPE)
			.stream()
			.toList();
	}

	private Optional<CosmosItemResponse<Map<String, Object>>> readItem(String id, PartitionKey partitionKey) {
		try {
			return Optional.of(activeContainer().readItem(id, partitionKey, DOCUMENT_TYPE));
		} catch (CosmosException e) {
			if (e.getStatusCode() == NOT_FOUND) {
				return Optional.empty();
			}
			throw e;
		}
	}

	private CosmosContainer activeContainer() {
		CosmosContainer c = container;
		if (c == null) {
			throw new BackendConnectionException("Cosmos DB client has been disposed");
		}
		return c;
	}

	private static Map<String, Object> newDocument(
		String id, String threadId, String checkpointId,
		Map<String, Object> state, @Nullable Map<String, Object> metadata,
		String createdAt, String updatedAt
	) {
		Map<String, Object> document = new LinkedHashMap<>();
		document.put(ID, id);
		document.put(THREAD_ID, threadId);
		document.put(CHECKPOINT_ID, checkpointId);
		document.put(STATE, state);
		if (metadata != null) {
			document.put(METADATA, metadata);
		}
		document.put(CREATED_AT, createdAt);
		document.put(UPDATED_AT, updatedAt);
		return document;
	}

	private StateDocument toDocument(Map<String, Object> document) {
		Object state = document.get(STATE);
		if (state == null) {
			throw new StateSerializationException("Stored document " + document.get(ID) + " has no state");
		}
		return new StateDocument(
			requiredString(document, THREAD_ID),
			requiredString(document, CHECKPOINT_ID),
			requireNonNull(json.fromValue(state, "state")),
			json.fromValue(document.get(METADATA), "metadata"),
			requiredTimestamp(document, CREATED_AT),
			requiredTimestamp(document, UPDATED_AT));
	}

	private static String requiredString(Map<String, Object> document, String field) {
		if (document.get(field) instanceof String s) {
			return s;
		} else {
			throw new StateSerializationException("Stored document " + document.get(ID) + " has no string " + field);
		}
	}

	private static Instant requiredTimestamp(Map<String, Object> document, String field) {
		return parse(requiredString(document, field));
	}

	/**
	 * Cosmos DB forbids {@code / \ ? #} in document ids, so those are percent-escaped,
	 * along with {@code %} itself so that distinct inputs stay distinct.
	 * The partition key is the thread, so ids need only be unique within a thread.
	 */
	static String documentID(String threadId, String checkpointId) {
		return escape(threadId) + "_" + escape(checkpointId);
	}

	private static String escape(String s) {
		StringBuilder sb = new StringBuilder(s.length());
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '%', '/', '\\', '?', '#' -> sb.append('%').append(String.format("%02X", (int) c));
				default -> sb.append(c);
			}
		}
		return sb.toString();
	}

	private String containerDescription() {
		return cosmosSettings.database() + "/" + settings.tableName();
	}

	private StatePersistenceException translate(String operation, CosmosException e) {
		if (e.getStatusCode() == REQUEST_TIMEOUT) {
			return new PersistenceTimeoutException(operation + " exceeded " + settings.operationTimeoutMS() + " ms", e);
		}
		return new BackendConnectionException(operation + " failed on container \"" + containerDescription() + "\" with status " + e.getStatusCode(), e);
	}

	static final String ID = "id";
	static final String THREAD_ID = "thread_id";
	static final String CHECKPOINT_ID = "checkpoint_id";
	static final String STATE = "state";
	static final String METADATA = "metadata";
	static final String CREATED_AT = "created_at";
	static final String UPDATED_AT = "updated_at";

	private static final int NOT_FOUND = 404;
	private static final int REQUEST_TIMEOUT = 408;
	private static final int CONFLICT = 409;

	@SuppressWarnings({"rawtypes", "unchecked"})
	private static final Class<Map<String, Object>> DOCUMENT_TYPE = (Class) Map.class;

	private static final Logger LOGGER = LoggerFactory.getLogger(CosmosStatePersistenceImpl.class);
}
