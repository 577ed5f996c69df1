package com.scholary.storage.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SyncPlannerTest {

  private static final Map<String, String> PRIMARY = Map.of("a", "e1", "b", "e2", "c", "e3");
  private static final Map<String, String> BACKUP = Map.of("b", "e2", "c", "changed", "d", "e4");

  @Test
  void primaryToBackupCopiesOnlyMissingBackupKeys() {
    SyncPlan plan = SyncPlanner.plan(PRIMARY, BACKUP, SyncDirection.PRIMARY_TO_BACKUP);

    assertThat(plan.toBackup()).containsExactly("a");
    assertThat(plan.toPrimary()).isEmpty();
    assertThat(plan.conflicts()).isEmpty();
  }

  @Test
  void backupToPrimaryCopiesOnlyMissingPrimaryKeys() {
    SyncPlan plan = SyncPlanner.plan(PRIMARY, BACKUP, SyncDirection.BACKUP_TO_PRIMARY);

    assertThat(plan.toBackup()).isEmpty();
    assertThat(plan.toPrimary()).containsExactly("d");
  }

  @Test
  void bidirectionalReportsDifferingEtags() {
    SyncPlan plan = SyncPlanner.plan(PRIMARY, BACKUP, SyncDirection.BIDIRECTIONAL);

    assertThat(plan.toBackup()).containsExactly("a");
    assertThat(plan.toPrimary()).containsExactly("d");
    assertThat(plan.conflicts()).containsExactly("c");
  }

  @Test
  void missingEtagIsNeverAConflict() {
    Map<String, String> primary = new HashMap<>();
    primary.put("x", null);

    SyncPlan plan = SyncPlanner.plan(primary, Map.of("x", "e1"), SyncDirection.BIDIRECTIONAL);

    assertThat(plan.isEmpty()).isTrue();
  }

  @Test
  void keysAreSorted() {
    SyncPlan plan =
        SyncPlanner.plan(
            Map.of("z", "1", "m", "2", "a", "3"), Map.of(), SyncDirection.PRIMARY_TO_BACKUP);

    assertThat(plan.toBackup()).containsExactly("a", "m", "z");
  }
}
