package io.laneboard.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.laneboard.config.LaneBoardConfig;
import io.laneboard.error.BoardException;
import io.laneboard.error.ErrorKind;
import io.laneboard.error.ValidationException;
import io.laneboard.events.BoardEvent;
import io.laneboard.events.EventBroadcaster;
import io.laneboard.model.Assignee;
import io.laneboard.model.Author;
import io.laneboard.model.ColumnSpec;
import io.laneboard.model.Priority;
import io.laneboard.model.SearchHit;
import io.laneboard.model.SweepMove;
import io.laneboard.model.TaskDraft;
import io.laneboard.model.TaskFilter;
import io.laneboard.model.TaskPatch;
import io.laneboard.model.TaskView;
import io.laneboard.runtime.LaneBoardRuntime;
import io.laneboard.tools.ToolResponse;
import io.laneboard.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

@Command(
        name = "laneboard",
        mixinStandardHelpOptions = true,
        description = "Multi-board task engine CLI",
        subcommands = {
                LaneBoardCommand.InitCommand.class,
                LaneBoardCommand.AddCommand.class,
                LaneBoardCommand.MoveCommand.class,
                LaneBoardCommand.ReorderCommand.class,
                LaneBoardCommand.EditCommand.class,
                LaneBoardCommand.DropCommand.class,
                LaneBoardCommand.BlockCommand.class,
                LaneBoardCommand.SearchCommand.class,
                LaneBoardCommand.CommentCommand.class,
                LaneBoardCommand.CommentsCommand.class,
                LaneBoardCommand.ShowCommand.class,
                LaneBoardCommand.BoardCommand.class,
                LaneBoardCommand.ColumnCommand.class,
                LaneBoardCommand.ClearCommand.class,
                LaneBoardCommand.StatsCommand.class,
                LaneBoardCommand.SweepCommand.class,
                LaneBoardCommand.ListCommand.class,
                LaneBoardCommand.MineCommand.class,
                LaneBoardCommand.BoardsCommand.class,
                LaneBoardCommand.CreateBoardCommand.class,
                LaneBoardCommand.DeleteBoardCommand.class,
                LaneBoardCommand.ActiveCommand.class,
                LaneBoardCommand.ArchivedCommand.class,
                LaneBoardCommand.CallCommand.class,
                LaneBoardCommand.MaintenanceCommand.class,
                LaneBoardCommand.SettingsCommand.class,
                LaneBoardCommand.RuntimeStatsCommand.class,
                LaneBoardCommand.AuditTailCommand.class,
                LaneBoardCommand.AuditVerifyCommand.class,
                LaneBoardCommand.SchemaMigrationsCommand.class,
                LaneBoardCommand.ServeCommand.class
        }
)
public final class LaneBoardCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Namespace (separate data root)", defaultValue = "default")
    String namespace;

    @Option(names = {"--actor"}, description = "Acting party: human | ai", defaultValue = "ai")
    String actor;

    @Option(names = {"--board"}, description = "Board instance name", defaultValue = "default")
    String board;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | add | move | reorder | edit | drop | block | search | comment | comments | show | board | column | clear | stats | sweep | list | mine | boards | create-board | delete-board | active | archived | call | maintenance | settings | runtime-stats | audit-tail | audit-verify | schema-migrations | serve");
    }

    LaneBoardRuntime runtime() {
        LaneBoardConfig config = LaneBoardConfig.fromRoot(root, namespace);
        LaneBoardRuntime runtime = new LaneBoardRuntime(config, parseEnum(actor, Author::fromString, "actor"));
        runtime.init();
        return runtime;
    }

    /**
     * Runs {@code action} against a fresh runtime and prints its result as JSON. Engine failures
     * are printed in the tool error shape and exit with 1.
     */
    int print(Function<LaneBoardRuntime, Object> action) {
        try (LaneBoardRuntime runtime = runtime()) {
            System.out.println(Jsons.toJson(action.apply(runtime)));
            return 0;
        } catch (BoardException e) {
            System.err.println(Jsons.toJson(ToolResponse.failure(e)));
            return 1;
        }
    }

    static <T> T parseEnum(String raw, Function<String, T> parser, String field) {
        if (raw == null) {
            return null;
        }
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid " + field + ": " + raw, e);
        }
    }

    static List<String> nullIfEmpty(List<String> values) {
        return values == null || values.isEmpty() ? null : values;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Override
        public Integer call() {
            try (LaneBoardRuntime runtime = parent.runtime()) {
                System.out.println("Initialized LaneBoard at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "add", description = "Create a task (default column Backlog)")
    static final class AddCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Parameters(index = "0", description = "Task title")
        String title;

        @Option(names = {"--column"}, description = "Target column")
        String column;

        @Option(names = {"--priority"}, description = "low | medium | high")
        String priority;

        @Option(names = {"--assignee"}, description = "human | ai | unassigned")
        String assignee;

        @Option(names = {"--blocked-by"}, description = "Blocking task id (repeatable)")
        List<String> blockedBy = new ArrayList<>();

        @Option(names = {"--label"}, description = "Label (repeatable)")
        List<String> labels = new ArrayList<>();

        @Option(names = {"--link"}, description = "Related file or URL (repeatable)")
        List<String> links = new ArrayList<>();

        @Option(names = {"--description"}, description = "Task description")
        String description;

        @Option(names = {"--context"}, description = "Working context notes")
        String context;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().add(parent.board, new TaskDraft(
                    title,
                    description,
                    column,
                    parseEnum(priority, Priority::fromString, "priority"),
                    parseEnum(assignee, Assignee::fromString, "assignee"),
                    labels,
                    links,
                    context,
                    blockedBy,
                    null,
                    null
            )));
        }
    }

    @Command(name = "move", description = "Move a task to the end of a column")
    static final class MoveCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Parameters(index = "0", description = "Task id")
        String id;

        @Parameters(index = "1", description = "Target column")
        String column;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().move(parent.board, id, column));
        }
    }

    @Command(name = "reorder", description = "Reinsert a task before another task in a column")
    static final class ReorderCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Parameters(index = "0", description = "Task id")
        String id;

        @Parameters(index = "1", description = "Target column")
        String column;

        @Option(names = {"--before"}, description = "Task id to insert before (default: end of column)")
        String beforeId;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().reorder(parent.board, id, column, beforeId));
        }
    }

    @Command(name = "edit", description = "Update task fields")
    static final class EditCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Parameters(index = "0", description = "Task id")
        String id;

        @Option(names = {"--title"})
        String title;

        @Option(names = {"--description"})
        String description;

        @Option(names = {"--priority"}, description = "low | medium | high")
        String priority;

        @Option(names = {"--assignee"}, description = "human | ai | unassigned")
        String assignee;

        @Option(names = {"--label"}, description = "Replace labels (repeatable)")
        List<String> labels;

        @Option(names = {"--link"}, description = "Replace links (repeatable)")
        List<String> links;

        @Option(names = {"--context"})
        String context;

        @Option(names = {"--blocked-by"}, description = "Replace blockedBy (repeatable)")
        List<String> blockedBy;

        @Option(names = {"--auto-pull-threshold"})
        Integer autoPullThreshold;

        @Option(names = {"--auto-release-minutes"})
        Integer autoReleaseMinutes;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().edit(parent.board, id, new TaskPatch(
                    title,
                    description,
                    parseEnum(priority, Priority::fromString, "priority"),
                    parseEnum(assignee, Assignee::fromString, "assignee"),
                    nullIfEmpty(labels),
                    nullIfEmpty(links),
                    context,
                    nullIfEmpty(blockedBy),
                    autoPullThreshold,
                    autoReleaseMinutes
            )));
        }
    }

    @Command(name = "drop", description = "Delete a task and its comments")
    static final class DropCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Parameters(index = "0", description = "Task id")
        String id;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().drop(parent.board, id));
        }
    }

    @Command(name = "block", description = "Add or remove one dependency")
    static final class BlockCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Parameters(index = "0", description = "Task id")
        String id;

        @Parameters(index = "1", description = "Blocking task id")
        String blockedBy;

        @Option(names = {"--remove"}, description = "Remove the dependency instead of adding it")
        boolean remove;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().block(parent.board, id, blockedBy, remove));
        }
    }

    @Command(name = "search", description = "Case-insensitive search over title, description and context")
    static final class SearchCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Parameters(index = "0", description = "Query")
        String query;

        @Option(names = {"--all-boards"}, description = "Search every board instead of --board")
        boolean allBoards;

        @Override
        public Integer call() {
            return parent.print(runtime -> {
                if (allBoards) {
                    List<SearchHit> hits = new ArrayList<>();
                    runtime.engine().searchAll(query).forEach(hits::add);
                    return hits;
                }
                List<TaskView> out = new ArrayList<>();
                runtime.engine().search(parent.board, query).forEach(out::add);
                return out;
            });
        }
    }

    @Command(name = "comment", description = "Add a comment to a task")
    static final class CommentCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Parameters(index = "0", description = "Task id")
        String id;

        @Parameters(index = "1", description = "Comment text")
        String content;

        @Option(names = {"--author"}, description = "human | ai (default: --actor)")
        String author;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().comment(
                    parent.board, id, content, parseEnum(author, Author::fromString, "author")));
        }
    }

    @Command(name = "comments", description = "List a task's comments")
    static final class CommentsCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Parameters(index = "0", description = "Task id")
        String id;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().comments(parent.board, id));
        }
    }

    @Command(name = "show", description = "Show a task with its comments")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Parameters(index = "0", description = "Task id")
        String id;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().show(parent.board, id));
        }
    }

    @Command(name = "board", description = "Print the board snapshot")
    static final class BoardCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().board(parent.board));
        }
    }

    @Command(name = "column", description = "Add, remove, reposition or limit a column")
    static final class ColumnCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Parameters(index = "0", description = "Column name")
        String name;

        @Option(names = {"--remove"}, description = "Remove the column; its tasks go to Backlog")
        boolean remove;

        @Option(names = {"--position"}, description = "Column index (clamped between Backlog and Done)")
        Integer position;

        @Option(names = {"--wip-limit"}, description = "WIP limit (0 clears)")
        Integer wipLimit;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().column(parent.board, name, remove, position, wipLimit));
        }
    }

    @Command(name = "clear", description = "Archive every task in Done")
    static final class ClearCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Override
        public Integer call() {
            return parent.print(runtime -> Map.of("archived", runtime.engine().clear(parent.board)));
        }
    }

    @Command(name = "stats", description = "Per-column counts and WIP status")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().stats(parent.board));
        }
    }

    @Command(name = "sweep", description = "Apply several moves atomically under the board lock")
    static final class SweepCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Parameters(arity = "1..*", description = "Moves as <taskId>=<column>")
        List<String> moves;

        @Override
        public Integer call() {
            return parent.print(runtime -> {
                List<SweepMove> batch = new ArrayList<>();
                for (String raw : moves) {
                    int eq = raw.indexOf('=');
                    if (eq <= 0 || eq == raw.length() - 1) {
                        throw new ValidationException("Sweep move must look like <taskId>=<column>: " + raw);
                    }
                    batch.add(new SweepMove(raw.substring(0, eq).trim(), raw.substring(eq + 1).trim()));
                }
                return runtime.engine().sweep(parent.board, batch);
            });
        }
    }

    @Command(name = "list", description = "List tasks, optionally filtered")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Option(names = {"--column"})
        String column;

        @Option(names = {"--assignee"}, description = "human | ai | unassigned")
        String assignee;

        @Option(names = {"--priority"}, description = "low | medium | high")
        String priority;

        @Option(names = {"--label"})
        String label;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().list(parent.board, new TaskFilter(
                    column,
                    parseEnum(assignee, Assignee::fromString, "assignee"),
                    parseEnum(priority, Priority::fromString, "priority"),
                    label
            )));
        }
    }

    @Command(name = "mine", description = "Tasks assigned to the AI that are not done")
    static final class MineCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().mine(parent.board));
        }
    }

    @Command(name = "boards", description = "List boards, most recently updated first")
    static final class BoardsCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().boards());
        }
    }

    @Command(name = "create-board", description = "Create a board with custom columns")
    static final class CreateBoardCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Parameters(index = "0", description = "Board name")
        String name;

        @Option(names = {"--column"}, description = "Column as <name> or <name>:<wipLimit> (repeatable)")
        List<String> columns = new ArrayList<>();

        @Override
        public Integer call() {
            return parent.print(runtime -> {
                List<ColumnSpec> specs = new ArrayList<>();
                for (String raw : columns) {
                    int colon = raw.lastIndexOf(':');
                    if (colon > 0 && colon < raw.length() - 1) {
                        specs.add(new ColumnSpec(raw.substring(0, colon).trim(), parseLimit(raw.substring(colon + 1))));
                    } else {
                        specs.add(ColumnSpec.of(raw.trim()));
                    }
                }
                return runtime.engine().createBoard(name, specs);
            });
        }

        private static Integer parseLimit(String raw) {
            try {
                return Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Invalid WIP limit: " + raw, e);
            }
        }
    }

    @Command(name = "delete-board", description = "Delete a board and its archive")
    static final class DeleteBoardCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Parameters(index = "0", description = "Board name")
        String name;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().deleteBoard(name));
        }
    }

    @Command(name = "active", description = "Print the most recently updated board")
    static final class ActiveCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().activeBoard());
        }
    }

    @Command(name = "archived", description = "List archived tasks, newest first")
    static final class ArchivedCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50")
        int limit;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.engine().archived(parent.board, limit));
        }
    }

    @Command(name = "call", description = "Invoke a tool method with JSON params")
    static final class CallCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Parameters(index = "0", description = "Tool method, e.g. add, move, sweep")
        String method;

        @Option(names = {"--params"}, defaultValue = "{}", description = "JSON object of params")
        String params;

        @Override
        public Integer call() throws IOException {
            JsonNode node = Jsons.mapper().readTree(params);
            if (node != null && node.isObject() && !node.has("board") && !"issue".equals(method)) {
                ((ObjectNode) node).put("board", parent.board);
            }
            try (LaneBoardRuntime runtime = parent.runtime()) {
                ToolResponse response = runtime.dispatcher().call(method, node);
                System.out.println(Jsons.toJson(response));
                return response.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "maintenance", description = "Archive stale Done tasks and purge old archive rows")
    static final class MaintenanceCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Option(names = {"--loop"}, description = "Keep running on an interval")
        boolean loop;

        @Option(names = {"--interval-ms"}, defaultValue = "3600000", description = "Loop interval")
        long intervalMs;

        @Override
        public Integer call() throws InterruptedException {
            try (LaneBoardRuntime runtime = parent.runtime()) {
                if (!loop) {
                    System.out.println(Jsons.toJson(runtime.runMaintenance()));
                    return 0;
                }
                runtime.startMaintenance(Duration.ofMillis(intervalMs));
                System.out.println("Maintenance running every " + Math.max(1_000L, intervalMs) + "ms");
                Thread.currentThread().join();
                return 0;
            }
        }
    }

    @Command(name = "settings", description = "Print effective settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Override
        public Integer call() {
            return parent.print(LaneBoardRuntime::settings);
        }
    }

    @Command(name = "runtime-stats", description = "Print runtime counters")
    static final class RuntimeStatsCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Override
        public Integer call() {
            return parent.print(LaneBoardRuntime::stats);
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            try (LaneBoardRuntime runtime = parent.runtime()) {
                for (JsonNode row : runtime.auditTail(lines)) {
                    System.out.println(Jsons.toCompactJson(row));
                }
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Override
        public Integer call() {
            try (LaneBoardRuntime runtime = parent.runtime()) {
                int rows = runtime.verifyAudit();
                System.out.println(Jsons.toJson(Map.of("ok", true, "rows", rows)));
                return 0;
            } catch (IllegalStateException e) {
                System.out.println(Jsons.toJson(Map.of("ok", false, "error", e.getMessage())));
                return 1;
            }
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50")
        int limit;

        @Override
        public Integer call() {
            return parent.print(runtime -> runtime.schemaMigrations(limit));
        }
    }

    @Command(name = "serve", description = "Serve the tool surface over HTTP with an SSE event stream")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        LaneBoardCommand parent;

        @Option(names = {"--bind"}, defaultValue = "127.0.0.1", description = "Bind host")
        String bind;

        @Option(names = {"--port"}, defaultValue = "8088", description = "Bind port")
        int port;

        @Option(names = {"--maintenance-interval-ms"}, defaultValue = "3600000", description = "Archive maintenance interval (0 disables)")
        long maintenanceIntervalMs;

        @Override
        public Integer call() throws Exception {
            LaneBoardRuntime runtime = parent.runtime();
            if (maintenanceIntervalMs > 0) {
                runtime.startMaintenance(Duration.ofMillis(maintenanceIntervalMs));
            }
            HttpServer server = HttpServer.create(new InetSocketAddress(bind, port), 0);
            server.createContext("/health", exchange -> writeJson(exchange, Map.of("ok", true), 200));
            server.createContext("/tools/", exchange -> {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
                    return;
                }
                String method = exchange.getRequestURI().getPath().substring("/tools/".length());
                JsonNode params;
                try {
                    byte[] raw = exchange.getRequestBody().readAllBytes();
                    String body = new String(raw, StandardCharsets.UTF_8).trim();
                    params = body.isEmpty() ? Jsons.mapper().createObjectNode() : Jsons.mapper().readTree(body);
                } catch (IOException e) {
                    writeJson(exchange, ToolResponse.failure(new ValidationException("Request body is not valid JSON", e)), 400);
                    return;
                }
                ToolResponse response = runtime.dispatcher().call(method, params);
                writeJson(exchange, response, statusFor(response));
            });
            server.createContext("/events", exchange -> streamEvents(exchange, runtime.events(), parseQuery(exchange.getRequestURI()).get("board")));
            server.setExecutor(Executors.newCachedThreadPool());
            server.start();
            System.out.println("LaneBoard listening on http://" + bind + ":" + port + "/ (tools: POST /tools/{method}, events: GET /events?board=)");
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.stop(0);
                runtime.close();
            }));
            Thread.currentThread().join();
            return 0;
        }

        private static int statusFor(ToolResponse response) {
            if (response.ok()) {
                return 200;
            }
            ErrorKind kind = ErrorKind.valueOf(response.error().kind());
            return switch (kind) {
                case NOT_FOUND -> 404;
                case VALIDATION_ERROR -> 400;
                case DEPENDENCY_UNRESOLVED, WIP_LIMIT_EXCEEDED, CONFLICT_ON_WRITE -> 409;
                case LOCK_TIMEOUT -> 503;
            };
        }

        private static void streamEvents(HttpExchange exchange, EventBroadcaster events, String board) throws IOException {
            BlockingQueue<BoardEvent> queue = new LinkedBlockingQueue<>(1_000);
            String key = board == null || board.isBlank() ? null : LaneBoardConfig.sanitizeName(board, "default");
            exchange.getResponseHeaders().set("Content-Type", "text/event-stream; charset=utf-8");
            exchange.getResponseHeaders().set("Cache-Control", "no-cache");
            exchange.getResponseHeaders().set("Connection", "keep-alive");
            exchange.sendResponseHeaders(200, 0);
            try (EventBroadcaster.Subscription subscription = events.subscribe(key, queue::offer);
                 OutputStream os = exchange.getResponseBody()) {
                while (true) {
                    BoardEvent event = queue.poll(15, TimeUnit.SECONDS);
                    String frame = event == null
                            ? ": keepalive\n\n"
                            : "id: " + event.board() + ":" + event.version() + "\nevent: " + event.kind().wireName()
                            + "\ndata: " + Jsons.toCompactJson(event) + "\n\n";
                    os.write(frame.getBytes(StandardCharsets.UTF_8));
                    os.flush();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (IOException e) {
                // Client disconnected.
                exchange.close();
            }
        }
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            out.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return out;
    }
}
