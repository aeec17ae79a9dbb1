package io.github.yok.flexbackup.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexbackup.model.EntityExportSpec;
import io.github.yok.flexbackup.model.IncrementalStreamSpec;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Fixed set of exported entities and their queries.
 *
 * <p>
 * Issues are exported with {@code SELECT *} because the table is wide and gains columns over time;
 * the other entities use explicit projections. Each shadow query reads the {@code wisp*} table
 * holding the same entity.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class BackupCatalog {

    public static final String ISSUES = "issues";
    public static final String EVENTS = "events";
    public static final String COMMENTS = "comments";
    public static final String DEPENDENCIES = "dependencies";
    public static final String LABELS = "labels";
    public static final String CONFIG = "config";

    private static final String COMMENT_COLUMNS = "id, issue_id, author, text, created_at";

    private static final String DEPENDENCY_COLUMNS =
            "issue_id, depends_on_id, type, created_at, created_by";

    private static final String EVENT_COLUMNS =
            "id, issue_id, event_type, actor, old_value, new_value, comment, created_at";

    /**
     * Full-snapshot entities in export order.
     */
    public static final ImmutableList<EntityExportSpec> SNAPSHOT_ENTITIES = ImmutableList.of(
            EntityExportSpec.builder().name(ISSUES).fileName("issues.jsonl")
                    .primaryQuery("SELECT * FROM issues ORDER BY id")
                    .shadowQuery("SELECT * FROM wisps ORDER BY id")
                    .orderKey("id").build(),
            EntityExportSpec.builder().name(COMMENTS).fileName("comments.jsonl")
                    .primaryQuery("SELECT " + COMMENT_COLUMNS + " FROM comments ORDER BY id")
                    .shadowQuery("SELECT " + COMMENT_COLUMNS + " FROM wisp_comments ORDER BY id")
                    .orderKey("id").build(),
            EntityExportSpec.builder().name(DEPENDENCIES).fileName("dependencies.jsonl")
                    .primaryQuery("SELECT " + DEPENDENCY_COLUMNS
                            + " FROM dependencies ORDER BY issue_id, depends_on_id")
                    .shadowQuery("SELECT " + DEPENDENCY_COLUMNS
                            + " FROM wisp_dependencies ORDER BY issue_id, depends_on_id")
                    .orderKey("issue_id").orderKey("depends_on_id").build(),
            EntityExportSpec.builder().name(LABELS).fileName("labels.jsonl")
                    .primaryQuery("SELECT issue_id, label FROM labels ORDER BY issue_id, label")
                    .shadowQuery(
                            "SELECT issue_id, label FROM wisp_labels ORDER BY issue_id, label")
                    .orderKey("issue_id").orderKey("label").build(),
            EntityExportSpec.builder().name(CONFIG).fileName("config.jsonl")
                    .primaryQuery("SELECT `key`, value FROM config ORDER BY `key`")
                    .orderKey("key").build());

    /**
     * The append-only events stream.
     */
    public static final IncrementalStreamSpec EVENT_STREAM = IncrementalStreamSpec.builder()
            .name(EVENTS).fileName("events.jsonl")
            .primaryQuery("SELECT " + EVENT_COLUMNS + " FROM events WHERE id > ? ORDER BY id ASC")
            .shadowQuery(
                    "SELECT " + EVENT_COLUMNS + " FROM wisp_events WHERE id > ? ORDER BY id ASC")
            .keyColumn("id").build();

    /**
     * Entity names in the order used for {@code counts} in the state file.
     */
    public static final ImmutableList<String> ENTITY_NAMES =
            ImmutableList.of(ISSUES, EVENTS, COMMENTS, DEPENDENCIES, LABELS, CONFIG);
}
