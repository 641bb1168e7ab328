package dk.cloudcreate.changetracking.changes;

/**
 * The status of a {@link ChangeScope}
 */
public enum ChangeScopeStatus {
    /**
     * The {@link ChangeScope} has been started and records the changes made through it
     */
    Started(false),
    /**
     * The {@link ChangeScope} has been committed and its changes kept in the {@link ChangeRecord}
     */
    Committed(true),
    /**
     * The {@link ChangeScope} has been rolled back and all changes made after its checkpoint reverted
     */
    RolledBack(true);

    public final boolean isCompleted;

    ChangeScopeStatus(boolean isCompleted) {
        this.isCompleted = isCompleted;
    }

    public boolean isCompleted() {
        return isCompleted;
    }
}
