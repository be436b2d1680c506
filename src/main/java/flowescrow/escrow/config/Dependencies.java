package flowescrow.escrow.config;

import flowescrow.escrow.api.v1.BalanceController;
import flowescrow.escrow.api.v1.EventController;
import flowescrow.escrow.api.v1.FeeController;
import flowescrow.escrow.api.v1.HealthController;
import flowescrow.escrow.api.v1.RoleController;
import flowescrow.escrow.api.v1.TaskController;
import flowescrow.escrow.asset.JdbcTokenLedger;
import flowescrow.escrow.core.EscrowEventBus;
import flowescrow.escrow.repository.EventRepository;
import flowescrow.escrow.repository.FeePolicyRepository;
import flowescrow.escrow.repository.RoleRepository;
import flowescrow.escrow.repository.SubtaskPaymentRepository;
import flowescrow.escrow.repository.TaskRepository;
import flowescrow.escrow.server.RouterHandler;
import flowescrow.escrow.service.AccessControl;
import flowescrow.escrow.service.EscrowService;
import flowescrow.escrow.store.Database;
import flowescrow.escrow.store.JdbcEventRepository;
import flowescrow.escrow.store.JdbcFeePolicyRepository;
import flowescrow.escrow.store.JdbcRoleRepository;
import flowescrow.escrow.store.JdbcSubtaskPaymentRepository;
import flowescrow.escrow.store.JdbcTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies and initializes an empty ledger.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EscrowConfig.fromEnv());
 * EscrowService escrow = deps.escrowService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final Database database;
    private final JdbcTokenLedger tokenLedger;
    private final EscrowService escrowService;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(EscrowConfig config) {
        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.tokenLedger = new JdbcTokenLedger(database, config.custodyAccount());
        EscrowEventBus eventBus = new EscrowEventBus();

        // Repositories
        TaskRepository taskRepository = new JdbcTaskRepository(database);
        SubtaskPaymentRepository paymentRepository = new JdbcSubtaskPaymentRepository(database);
        FeePolicyRepository feePolicyRepository = new JdbcFeePolicyRepository(database);
        RoleRepository roleRepository = new JdbcRoleRepository(database);
        EventRepository eventRepository = new JdbcEventRepository(database);

        // Services
        AccessControl accessControl = new AccessControl(roleRepository);
        this.escrowService = new EscrowService(database, taskRepository, paymentRepository,
                feePolicyRepository, eventRepository, accessControl, tokenLedger, eventBus);

        if (escrowService.initialize(config.deployer(), config.initialFeeBps(), config.initialFeeRecipient())) {
            log.info("Initialized empty ledger for deployer {}", config.deployer());
        }

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(EscrowConfig config) {
        return new Dependencies(config);
    }

    // Getters
    public JdbcTokenLedger tokenLedger() {
        return tokenLedger;
    }

    public EscrowService escrowService() {
        return escrowService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(database, escrowService))
                    .registerController(new TaskController(escrowService))
                    .registerController(new FeeController(escrowService))
                    .registerController(new RoleController(escrowService))
                    .registerController(new EventController(escrowService))
                    .registerController(new BalanceController(escrowService));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }
        log.info("Dependencies closed");
    }
}
