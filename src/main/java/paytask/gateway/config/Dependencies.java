package paytask.gateway.config;

import paytask.gateway.api.internal.v1.InitController;
import paytask.gateway.api.v1.AccountController;
import paytask.gateway.api.v1.HealthController;
import paytask.gateway.api.v1.OrderController;
import paytask.gateway.api.v1.OwnerController;
import paytask.gateway.api.v1.TaskController;
import paytask.gateway.ledger.HttpLedgerClient;
import paytask.gateway.ledger.LedgerClient;
import paytask.gateway.ledger.LedgerVerifier;
import paytask.gateway.repository.OrderRepository;
import paytask.gateway.repository.OwnerIndexRepository;
import paytask.gateway.repository.TaskRepository;
import paytask.gateway.scheduler.OrderExpiryScheduler;
import paytask.gateway.scheduler.OwnerIndexReconciler;
import paytask.gateway.scheduler.Scheduler;
import paytask.gateway.server.RouterHandler;
import paytask.gateway.service.CorrelationIdGenerator;
import paytask.gateway.service.OrderService;
import paytask.gateway.service.TaskService;
import paytask.gateway.store.Database;
import paytask.gateway.store.JdbcOrderRepository;
import paytask.gateway.store.JdbcOwnerIndexRepository;
import paytask.gateway.store.JdbcTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 * 
 * Usage:
 * 
 * <pre>
 * Dependencies deps = Dependencies.create(GatewayConfig.fromEnv());
 * deps.startScheduler(); // index repair, leftover order expiry
 * TaskService taskService = deps.taskService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final GatewayConfig config;
    private final Clock clock;
    private final Database database;
    private final OrderRepository orderRepository;
    private final TaskRepository taskRepository;
    private final OwnerIndexRepository ownerIndexRepository;
    private final FeeRegistry feeRegistry;
    private final LedgerVerifier ledgerVerifier;
    private final OwnerIndexReconciler ownerIndexReconciler;
    private final Scheduler scheduler;
    private final OrderExpiryScheduler expiryScheduler;
    private final OrderService orderService;
    private final TaskService taskService;

    // Controllers
    private final HealthController healthController;
    private final OrderController orderController;
    private final TaskController taskController;
    private final OwnerController ownerController;
    private final AccountController accountController;
    private final InitController initController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(GatewayConfig config, LedgerClient ledgerClient, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Fees first, so a bad fees file fails before the pool opens
        this.feeRegistry = new FeeRegistry();
        loadFees(config, feeRegistry);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.orderRepository = new JdbcOrderRepository(database);
        this.taskRepository = new JdbcTaskRepository(database);
        this.ownerIndexRepository = new JdbcOwnerIndexRepository(database);

        // Background work
        this.ownerIndexReconciler = new OwnerIndexReconciler(taskRepository, ownerIndexRepository);
        this.scheduler = new Scheduler(ownerIndexReconciler, config);
        this.expiryScheduler = new OrderExpiryScheduler(orderRepository, scheduler, config, clock);

        // Services
        this.ledgerVerifier = new LedgerVerifier(ledgerClient, config.serviceIdentity());
        this.orderService = new OrderService(orderRepository, expiryScheduler, new CorrelationIdGenerator(clock),
                feeRegistry, clock);
        this.taskService = new TaskService(taskRepository, ownerIndexRepository, orderService, ledgerVerifier,
                feeRegistry, clock);

        // Controllers (public API)
        this.healthController = new HealthController(database, feeRegistry, scheduler, expiryScheduler, orderService,
                taskService);
        this.orderController = new OrderController(orderService);
        this.taskController = new TaskController(taskService);
        this.ownerController = new OwnerController(taskService);
        this.accountController = new AccountController(config);

        // Controllers (operator API)
        this.initController = new InitController(feeRegistry);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and an HTTP ledger client.
     */
    public static Dependencies create(GatewayConfig config) {
        return new Dependencies(config, new HttpLedgerClient(config), Clock.systemUTC());
    }

    /**
     * Create dependencies with a custom ledger client and clock.
     */
    public static Dependencies create(GatewayConfig config, LedgerClient ledgerClient, Clock clock) {
        return new Dependencies(config, ledgerClient, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(GatewayConfig.fromEnv());
    }

    private static void loadFees(GatewayConfig config, FeeRegistry registry) {
        if (config.feesFile() == null) {
            log.info("No fees file configured; waiting for POST /internal/v1/init");
            return;
        }
        try {
            FeeIniLoader.load(config.feesFile().toFile()).ifPresent(registry::initialize);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read fees file " + config.feesFile(), e);
        }
    }

    // Getters
    public GatewayConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public OrderRepository orderRepository() {
        return orderRepository;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public OwnerIndexRepository ownerIndexRepository() {
        return ownerIndexRepository;
    }

    public FeeRegistry feeRegistry() {
        return feeRegistry;
    }

    public LedgerVerifier ledgerVerifier() {
        return ledgerVerifier;
    }

    public OrderExpiryScheduler expiryScheduler() {
        return expiryScheduler;
    }

    public OwnerIndexReconciler ownerIndexReconciler() {
        return ownerIndexReconciler;
    }

    public OrderService orderService() {
        return orderService;
    }

    public TaskService taskService() {
        return taskService;
    }

    public HealthController healthController() {
        return healthController;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(orderController)
                    .registerController(taskController)
                    .registerController(ownerController)
                    .registerController(accountController)
                    .registerController(initController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Start index reconciliation and re-arm expiry for orders left pending by a previous run.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler.start();
        int rescheduled = expiryScheduler.rescheduleOutstanding();
        if (rescheduled > 0) {
            log.info("Re-armed expiry for {} pending orders", rescheduled);
        }
    }

    /**
     * Stop the background scheduler.
     */
    public void stopScheduler() {
        scheduler.stop();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
