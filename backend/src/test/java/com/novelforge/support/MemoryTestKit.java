package com.novelforge.support;

import com.novelforge.config.MemoryProperties;
import com.novelforge.config.ResilienceConfig;
import com.novelforge.persistence.memory.InMemoryNarrativeStore;
import com.novelforge.service.cache.RetrievalQueryCache;
import com.novelforge.service.consistency.ConsistencyChecker;
import com.novelforge.service.context.ContextAssembler;
import com.novelforge.service.context.ProjectContextRegistry;
import com.novelforge.service.graph.KnowledgeGraphService;
import com.novelforge.service.memory.LongTermMemoryStore;
import com.novelforge.service.memory.NarrativeMemoryFacade;
import com.novelforge.service.orchestrator.GenerationOrchestrator;
import com.novelforge.service.support.ProjectLockRegistry;
import com.novelforge.service.support.ProviderCallRunner;
import com.novelforge.service.support.TransientRetryExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 测试用的完整组件装配：内存存储 + 确定性模型服务
 */
public class MemoryTestKit implements AutoCloseable {

    public static final int DIMENSION = 64;

    public final MemoryProperties properties;
    public final InMemoryNarrativeStore store;
    public final RetrievalQueryCache cache;
    public final ProjectLockRegistry locks;
    public final TransientRetryExecutor retryExecutor;
    public final ThreadPoolTaskExecutor providerExecutor;
    public final ThreadPoolTaskExecutor taskExecutor;
    public final ProviderCallRunner callRunner;
    public final HashEmbeddingProvider embeddings;
    public final ScriptedGenerationProvider generation;
    public final ScriptedExtractionProvider extraction;
    public final RecordingSummarizationProvider summarization;
    public final KnowledgeGraphService graph;
    public final LongTermMemoryStore memory;
    public final NarrativeMemoryFacade facade;
    public final ContextAssembler assembler;
    public final ProjectContextRegistry contexts;
    public final ConsistencyChecker checker;
    public final GenerationOrchestrator orchestrator;

    public MemoryTestKit() {
        this(defaultProperties());
    }

    public MemoryTestKit(MemoryProperties properties) {
        this(properties, new HashEmbeddingProvider(DIMENSION));
    }

    public MemoryTestKit(MemoryProperties properties, HashEmbeddingProvider embeddings) {
        this.properties = properties;
        this.embeddings = embeddings;
        this.store = new InMemoryNarrativeStore();
        this.cache = new RetrievalQueryCache(properties);
        this.locks = new ProjectLockRegistry();
        this.retryExecutor = new TransientRetryExecutor(new ResilienceConfig().retryRegistry(properties));
        this.providerExecutor = executor("test-provider-", 16);
        this.taskExecutor = executor("test-task-", 8);
        this.callRunner = new ProviderCallRunner(providerExecutor, retryExecutor);
        this.generation = new ScriptedGenerationProvider();
        this.extraction = new ScriptedExtractionProvider();
        this.summarization = new RecordingSummarizationProvider();

        this.graph = new KnowledgeGraphService(store, store, store, locks, cache);
        this.memory = new LongTermMemoryStore(store, store, store, store, locks, graph, embeddings, callRunner,
            cache, retryExecutor, properties);
        this.facade = new NarrativeMemoryFacade(memory, graph, store, locks, cache, properties);
        this.assembler = new ContextAssembler(memory, graph, properties);
        this.contexts = new ProjectContextRegistry(memory, summarization, callRunner, properties);
        this.checker = new ConsistencyChecker(properties);
        this.orchestrator = new GenerationOrchestrator(assembler, contexts, checker, graph, memory, generation,
            extraction, callRunner, retryExecutor, locks, store, cache, taskExecutor, properties);
    }

    public static MemoryProperties defaultProperties() {
        MemoryProperties properties = new MemoryProperties();
        properties.setPersistence("memory");
        properties.setEmbeddingDimension(DIMENSION);
        properties.setBackoffInitialMs(1);
        properties.setGenerationTimeoutMs(5_000);
        properties.setExtractionTimeoutMs(5_000);
        properties.setEmbeddingTimeoutMs(5_000);
        properties.setSummarizationTimeoutMs(5_000);
        return properties;
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int size) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix(prefix);
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }

    @Override
    public void close() {
        taskExecutor.shutdown();
        providerExecutor.shutdown();
    }
}
