package flowescrow.escrow.service;

import flowescrow.escrow.asset.FungibleAsset;
import flowescrow.escrow.core.EscrowEventBus;
import flowescrow.escrow.model.EscrowError;
import flowescrow.escrow.model.EscrowEvent;
import flowescrow.escrow.model.EscrowEventType;
import flowescrow.escrow.model.EscrowException;
import flowescrow.escrow.model.FeePolicy;
import flowescrow.escrow.model.FeeSplit;
import flowescrow.escrow.model.Role;
import flowescrow.escrow.model.SubtaskPayment;
import flowescrow.escrow.model.Task;
import flowescrow.escrow.model.TaskStatus;
import flowescrow.escrow.repository.EventRepository;
import flowescrow.escrow.repository.FeePolicyRepository;
import flowescrow.escrow.repository.SubtaskPaymentRepository;
import flowescrow.escrow.repository.TaskRepository;
import flowescrow.escrow.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Escrow state machine.
 * <p>
 * Every mutating operation holds the {@link ReentrancyGuard} and runs in one database
 * transaction: validate, write the ledger, move tokens through the {@link FungibleAsset},
 * append the audit event, commit. Any rejection rolls the whole transaction back.
 * Committed events are published to the {@link EscrowEventBus} after the guard is released.
 *
 * <pre>
 * FUNDED      --approveSubtask--> IN_PROGRESS
 * FUNDED      --cancelTask------> CANCELLED
 * FUNDED      --raiseDispute----> DISPUTED
 * IN_PROGRESS --approveSubtask--> IN_PROGRESS
 * IN_PROGRESS --completeTask----> COMPLETED
 * IN_PROGRESS --raiseDispute----> DISPUTED
 * DISPUTED    --resolveDispute--> RESOLVED
 * </pre>
 */
public class EscrowService {

    private static final Logger log = LoggerFactory.getLogger(EscrowService.class);

    private final Database database;
    private final TaskRepository taskRepository;
    private final SubtaskPaymentRepository paymentRepository;
    private final FeePolicyRepository feePolicyRepository;
    private final EventRepository eventRepository;
    private final AccessControl accessControl;
    private final FungibleAsset asset;
    private final EscrowEventBus eventBus;
    private final ReentrancyGuard guard = new ReentrancyGuard();

    @FunctionalInterface
    private interface Operation<T> {
        T run(Connection conn, List<EscrowEvent> emitted) throws SQLException;
    }

    public EscrowService(Database database,
            TaskRepository taskRepository,
            SubtaskPaymentRepository paymentRepository,
            FeePolicyRepository feePolicyRepository,
            EventRepository eventRepository,
            AccessControl accessControl,
            FungibleAsset asset,
            EscrowEventBus eventBus) {
        this.database = database;
        this.taskRepository = taskRepository;
        this.paymentRepository = paymentRepository;
        this.feePolicyRepository = feePolicyRepository;
        this.eventRepository = eventRepository;
        this.accessControl = accessControl;
        this.asset = asset;
        this.eventBus = eventBus;
    }

    /**
     * One-time setup of an empty ledger: the deployer receives every role and the fee
     * policy is seeded. Does nothing when the ledger already has role holders.
     *
     * @return true if the ledger was initialized by this call
     */
    public boolean initialize(String deployer, int feeBps, String feeRecipient) {
        return execute("initialize escrow", (conn, emitted) -> {
            if (!accessControl.bootstrap(conn, deployer)) {
                return false;
            }
            for (Role role : Role.values()) {
                emit(conn, emitted, EscrowEventType.ROLE_GRANTED, 0, deployer,
                        details("role", role.name(), "account", deployer));
            }
            if (feePolicyRepository.find(conn).isEmpty()) {
                FeePolicy policy = validatedPolicy(feeBps, feeRecipient);
                feePolicyRepository.save(conn, policy);
                emit(conn, emitted, EscrowEventType.FEE_UPDATED, 0, deployer,
                        details("oldFeeBps", null, "newFeeBps", policy.feeBps()));
                emit(conn, emitted, EscrowEventType.FEE_RECIPIENT_UPDATED, 0, deployer,
                        details("oldRecipient", null, "newRecipient", policy.feeRecipient()));
            }
            log.info("Escrow initialized: deployer={}, feeBps={}, feeRecipient={}", deployer, feeBps, feeRecipient);
            return true;
        });
    }

    // ---------------------------------------------------------------- mutations

    /**
     * Deposit {@code amount} from the caller and open a new task.
     *
     * @return the new task id
     */
    public long fund(String caller, long amount) {
        return execute("fund task", (conn, emitted) -> {
            if (amount <= 0) {
                throw new EscrowException(EscrowError.INVALID_AMOUNT, "amount must be positive: " + amount);
            }
            if (!AccessControl.isValidIdentity(caller)) {
                throw new EscrowException(EscrowError.INVALID_ADDRESS, "caller is required");
            }
            if (!asset.debitFrom(conn, caller, amount)) {
                throw new EscrowException(EscrowError.TRANSFER_FAILED,
                        "debit of " + amount + " from " + caller + " rejected");
            }

            long taskId = taskRepository.allocateId(conn);
            Task task = Task.builder()
                    .id(taskId)
                    .client(caller)
                    .totalAmount(amount)
                    .status(TaskStatus.FUNDED)
                    .createdAt(Instant.now())
                    .build();
            taskRepository.insert(conn, task);

            emit(conn, emitted, EscrowEventType.TASK_FUNDED, taskId, caller,
                    details("client", caller, "amount", amount));
            log.info("Task {} funded by {} with {}", taskId, caller, amount);
            return taskId;
        });
    }

    /**
     * Pay a subtask: the worker receives the amount minus the platform fee, the fee
     * recipient receives the fee. Each (taskId, subtaskIndex) key pays at most once.
     */
    public void approveSubtask(String caller, long taskId, int subtaskIndex, String worker, long amount) {
        execute("approve subtask", (conn, emitted) -> {
            Task task = loadForUpdate(conn, taskId);
            if (!task.status().isOpen()) {
                throw invalidStatus(task, "approveSubtask");
            }
            accessControl.requireClientOrAdmin(conn, task, caller);
            if (!AccessControl.isValidIdentity(worker)) {
                throw new EscrowException(EscrowError.INVALID_ADDRESS, "worker is required");
            }
            if (subtaskIndex < 0 || amount < 0) {
                throw new EscrowException(EscrowError.INVALID_AMOUNT,
                        "subtask index and amount must not be negative");
            }
            Optional<SubtaskPayment> existing = paymentRepository.find(conn, taskId, subtaskIndex);
            if (existing.isPresent() && existing.get().paid()) {
                throw new EscrowException(EscrowError.ALREADY_PAID,
                        "subtask " + subtaskIndex + " of task " + taskId + " already paid");
            }
            if (amount > task.remainingAmount()) {
                throw new EscrowException(EscrowError.EXCEEDS_BUDGET,
                        "amount " + amount + " exceeds remaining budget " + task.remainingAmount()
                                + " of task " + taskId);
            }

            FeePolicy policy = currentPolicy(conn);
            FeeSplit split = policy.split(amount);

            // Ledger first, then the external transfers
            paymentRepository.markPaid(conn,
                    new SubtaskPayment(taskId, subtaskIndex, worker, amount, true, Instant.now()));
            taskRepository.update(conn, task.toBuilder()
                    .releasedAmount(task.releasedAmount() + amount)
                    .status(TaskStatus.IN_PROGRESS)
                    .build());

            credit(conn, worker, split.workerAmount());
            credit(conn, policy.feeRecipient(), split.fee());

            emit(conn, emitted, EscrowEventType.SUBTASK_APPROVED, taskId, caller,
                    details("subtaskIndex", subtaskIndex,
                            "worker", worker,
                            "amount", amount,
                            "workerAmount", split.workerAmount(),
                            "fee", split.fee(),
                            "feeRecipient", policy.feeRecipient()));
            log.info("Task {} subtask {} approved: {} to {}, fee {}",
                    taskId, subtaskIndex, split.workerAmount(), worker, split.fee());
            return null;
        });
    }

    /**
     * Close an in-progress task and refund the unreleased remainder to the client.
     */
    public void completeTask(String caller, long taskId) {
        execute("complete task", (conn, emitted) -> {
            Task task = loadForUpdate(conn, taskId);
            if (task.status() != TaskStatus.IN_PROGRESS) {
                throw invalidStatus(task, "completeTask");
            }
            accessControl.requireClientOrAdmin(conn, task, caller);

            long refund = task.remainingAmount();
            taskRepository.update(conn, task.toBuilder().status(TaskStatus.COMPLETED).build());
            credit(conn, task.client(), refund);

            emit(conn, emitted, EscrowEventType.TASK_COMPLETED, taskId, caller,
                    details("client", task.client(), "released", task.releasedAmount(), "refund", refund));
            log.info("Task {} completed, refunded {} to {}", taskId, refund, task.client());
            return null;
        });
    }

    /**
     * Freeze an open task for arbitration. Any caller may raise a dispute.
     */
    public void raiseDispute(String caller, long taskId) {
        execute("raise dispute", (conn, emitted) -> {
            Task task = loadForUpdate(conn, taskId);
            if (!task.status().isOpen()) {
                throw invalidStatus(task, "raiseDispute");
            }
            taskRepository.update(conn, task.toBuilder().status(TaskStatus.DISPUTED).build());

            emit(conn, emitted, EscrowEventType.DISPUTE_RAISED, taskId, caller,
                    details("raisedBy", caller, "previousStatus", task.status().name()));
            log.info("Dispute raised on task {} by {}", taskId, caller);
            return null;
        });
    }

    /**
     * Admin arbitration: pay {@code winnerAmount} to the winner and refund the rest of the
     * unreleased budget to the client. No platform fee is taken.
     */
    public void resolveDispute(String caller, long taskId, String winner, long winnerAmount) {
        execute("resolve dispute", (conn, emitted) -> {
            accessControl.requireAdmin(conn, caller);
            Optional<Task> found = taskRepository.findForUpdate(conn, taskId);
            if (found.isEmpty() || found.get().status() != TaskStatus.DISPUTED) {
                throw new EscrowException(EscrowError.INVALID_STATUS,
                        "task " + taskId + " is not disputed");
            }
            Task task = found.get();
            if (winnerAmount < 0) {
                throw new EscrowException(EscrowError.INVALID_AMOUNT, "winnerAmount must not be negative");
            }
            if (winnerAmount > task.remainingAmount()) {
                throw new EscrowException(EscrowError.EXCEEDS_BUDGET,
                        "winnerAmount " + winnerAmount + " exceeds remaining budget " + task.remainingAmount()
                                + " of task " + taskId);
            }
            if (winnerAmount > 0 && !AccessControl.isValidIdentity(winner)) {
                throw new EscrowException(EscrowError.INVALID_ADDRESS, "winner is required");
            }

            Task resolved = task.toBuilder()
                    .releasedAmount(task.releasedAmount() + winnerAmount)
                    .status(TaskStatus.RESOLVED)
                    .build();
            long refund = resolved.remainingAmount();
            taskRepository.update(conn, resolved);

            credit(conn, winner, winnerAmount);
            credit(conn, task.client(), refund);

            emit(conn, emitted, EscrowEventType.DISPUTE_RESOLVED, taskId, caller,
                    details("winner", winner, "winnerAmount", winnerAmount,
                            "client", task.client(), "refund", refund));
            log.info("Dispute on task {} resolved: {} to {}, {} refunded to {}",
                    taskId, winnerAmount, winner, refund, task.client());
            return null;
        });
    }

    /**
     * Cancel a task before any work was paid and refund the whole deposit.
     */
    public void cancelTask(String caller, long taskId) {
        execute("cancel task", (conn, emitted) -> {
            Task task = loadForUpdate(conn, taskId);
            if (task.isTerminal()) {
                throw invalidStatus(task, "cancelTask");
            }
            if (task.status() != TaskStatus.FUNDED || task.releasedAmount() > 0) {
                throw new EscrowException(EscrowError.WORK_ALREADY_STARTED,
                        "task " + taskId + " is " + task.status() + " with " + task.releasedAmount() + " released");
            }
            accessControl.requireClientOrAdmin(conn, task, caller);

            taskRepository.update(conn, task.toBuilder().status(TaskStatus.CANCELLED).build());
            credit(conn, task.client(), task.totalAmount());

            emit(conn, emitted, EscrowEventType.TASK_CANCELLED, taskId, caller,
                    details("client", task.client(), "refund", task.totalAmount()));
            log.info("Task {} cancelled, refunded {} to {}", taskId, task.totalAmount(), task.client());
            return null;
        });
    }

    /**
     * Change the platform fee. Applies from the next release.
     */
    public void setFee(String caller, int newBps) {
        execute("set fee", (conn, emitted) -> {
            accessControl.requireAdmin(conn, caller);
            if (newBps < 0) {
                throw new EscrowException(EscrowError.INVALID_AMOUNT, "fee must not be negative: " + newBps);
            }
            if (newBps > FeePolicy.MAX_FEE_BPS) {
                throw new EscrowException(EscrowError.FEE_TOO_HIGH,
                        "fee " + newBps + " bps exceeds ceiling " + FeePolicy.MAX_FEE_BPS);
            }
            FeePolicy current = currentPolicy(conn);
            feePolicyRepository.save(conn, current.withFeeBps(newBps));

            emit(conn, emitted, EscrowEventType.FEE_UPDATED, 0, caller,
                    details("oldFeeBps", current.feeBps(), "newFeeBps", newBps));
            log.info("Fee changed from {} to {} bps by {}", current.feeBps(), newBps, caller);
            return null;
        });
    }

    /**
     * Change the account that receives fees. Applies from the next release.
     */
    public void setFeeRecipient(String caller, String newRecipient) {
        execute("set fee recipient", (conn, emitted) -> {
            accessControl.requireAdmin(conn, caller);
            requireFeeRecipient(newRecipient);
            FeePolicy current = currentPolicy(conn);
            feePolicyRepository.save(conn, current.withFeeRecipient(newRecipient));

            emit(conn, emitted, EscrowEventType.FEE_RECIPIENT_UPDATED, 0, caller,
                    details("oldRecipient", current.feeRecipient(), "newRecipient", newRecipient));
            log.info("Fee recipient changed from {} to {} by {}", current.feeRecipient(), newRecipient, caller);
            return null;
        });
    }

    /**
     * @return true if the account did not hold the role before
     */
    public boolean grantRole(String caller, Role role, String account) {
        return execute("grant role", (conn, emitted) -> {
            boolean changed = accessControl.grantRole(conn, caller, role, account);
            if (changed) {
                emit(conn, emitted, EscrowEventType.ROLE_GRANTED, 0, caller,
                        details("role", role.name(), "account", account));
                log.info("{} granted to {} by {}", role, account, caller);
            }
            return changed;
        });
    }

    /**
     * @return true if the account held the role before
     */
    public boolean revokeRole(String caller, Role role, String account) {
        return execute("revoke role", (conn, emitted) -> {
            boolean changed = accessControl.revokeRole(conn, caller, role, account);
            if (changed) {
                emit(conn, emitted, EscrowEventType.ROLE_REVOKED, 0, caller,
                        details("role", role.name(), "account", account));
                log.info("{} revoked from {} by {}", role, account, caller);
            }
            return changed;
        });
    }

    /**
     * Issue new tokens to a wallet (admin). Serialized with the escrow operations and
     * recorded in the event stream like them.
     */
    public void mintTokens(String caller, String account, long amount) {
        execute("mint tokens", (conn, emitted) -> {
            accessControl.requireAdmin(conn, caller);
            if (!AccessControl.isValidIdentity(account) || account.equals(asset.custodyAccount())) {
                throw new EscrowException(EscrowError.INVALID_ADDRESS, "invalid mint account: " + account);
            }
            if (amount <= 0) {
                throw new EscrowException(EscrowError.INVALID_AMOUNT, "mint amount must be positive: " + amount);
            }
            if (!asset.mint(conn, account, amount)) {
                throw new EscrowException(EscrowError.TRANSFER_FAILED, "mint of " + amount + " to " + account + " rejected");
            }

            emit(conn, emitted, EscrowEventType.TOKENS_MINTED, 0, caller,
                    details("account", account, "amount", amount));
            log.info("{} minted {} to {}", caller, amount, account);
            return null;
        });
    }

    // ---------------------------------------------------------------- queries

    public Optional<Task> getTask(long taskId) {
        return taskRepository.findById(taskId);
    }

    public Optional<SubtaskPayment> getSubtaskPayment(long taskId, int subtaskIndex) {
        return paymentRepository.find(taskId, subtaskIndex);
    }

    public List<SubtaskPayment> subtaskPayments(long taskId) {
        return paymentRepository.findByTask(taskId);
    }

    public List<Task> findTasksByClient(String client, int limit) {
        return taskRepository.findByClient(client, limit);
    }

    /** Id of the most recently funded task, 0 if none */
    public long taskCount() {
        return taskRepository.taskCount();
    }

    public int countByStatus(TaskStatus status) {
        return taskRepository.countByStatus(status);
    }

    public FeePolicy feePolicy() {
        return feePolicyRepository.find()
                .orElseThrow(() -> new IllegalStateException("escrow not initialized: no fee policy"));
    }

    public boolean isAdmin(String account) {
        return accessControl.isAdmin(account);
    }

    public List<String> roleMembers(Role role) {
        return accessControl.members(role);
    }

    public List<EscrowEvent> events(long afterSequence, int limit) {
        return eventRepository.findAfter(afterSequence, limit);
    }

    public List<EscrowEvent> taskEvents(long taskId) {
        return eventRepository.findByTask(taskId);
    }

    public Optional<EscrowEvent> event(long sequence) {
        return eventRepository.findBySequence(sequence);
    }

    public long balanceOf(String account) {
        return asset.balanceOf(account);
    }

    // ---------------------------------------------------------------- internals

    private <T> T execute(String what, Operation<T> operation) {
        List<EscrowEvent> emitted = new ArrayList<>();
        T result;
        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            result = database.inTransaction(what, conn -> operation.run(conn, emitted));
        } catch (EscrowException e) {
            log.warn("Rejected {}: {}", what, e.getMessage());
            throw e;
        }
        for (EscrowEvent event : emitted) {
            eventBus.publish(event);
        }
        return result;
    }

    private Task loadForUpdate(Connection conn, long taskId) throws SQLException {
        return taskRepository.findForUpdate(conn, taskId)
                .orElseThrow(() -> new EscrowException(EscrowError.TASK_NOT_FOUND, "task " + taskId + " not found"));
    }

    private FeePolicy currentPolicy(Connection conn) throws SQLException {
        return feePolicyRepository.find(conn)
                .orElseThrow(() -> new IllegalStateException("escrow not initialized: no fee policy"));
    }

    /** Zero-value credits are skipped */
    private void credit(Connection conn, String recipient, long amount) throws SQLException {
        if (amount == 0) {
            return;
        }
        if (!asset.creditTo(conn, recipient, amount)) {
            throw new EscrowException(EscrowError.TRANSFER_FAILED,
                    "credit of " + amount + " to " + recipient + " rejected");
        }
    }

    private void emit(Connection conn, List<EscrowEvent> emitted, EscrowEventType type, long taskId,
            String actor, Map<String, Object> details) throws SQLException {
        emitted.add(eventRepository.append(conn, EscrowEvent.pending(type, taskId, actor, details)));
    }

    private static EscrowException invalidStatus(Task task, String operation) {
        return new EscrowException(EscrowError.INVALID_STATUS,
                operation + " not allowed on task " + task.id() + " in status " + task.status());
    }

    private FeePolicy validatedPolicy(int feeBps, String feeRecipient) {
        if (feeBps > FeePolicy.MAX_FEE_BPS) {
            throw new EscrowException(EscrowError.FEE_TOO_HIGH,
                    "fee " + feeBps + " bps exceeds ceiling " + FeePolicy.MAX_FEE_BPS);
        }
        if (feeBps < 0) {
            throw new EscrowException(EscrowError.INVALID_AMOUNT, "fee must not be negative: " + feeBps);
        }
        requireFeeRecipient(feeRecipient);
        return new FeePolicy(feeBps, feeRecipient);
    }

    /** Custody cannot receive credits, so it would block every fee-bearing release */
    private void requireFeeRecipient(String feeRecipient) {
        if (!AccessControl.isValidIdentity(feeRecipient)) {
            throw new EscrowException(EscrowError.INVALID_ADDRESS, "fee recipient is required");
        }
        if (feeRecipient.equals(asset.custodyAccount())) {
            throw new EscrowException(EscrowError.INVALID_ADDRESS,
                    "fee recipient must not be the custody account " + feeRecipient);
        }
    }

    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
