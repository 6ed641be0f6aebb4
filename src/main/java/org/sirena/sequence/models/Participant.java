package org.sirena.sequence.models;

/**
 * A lifeline. Later declarations of the same id update label and kind.
 */
public class Participant {
    private final String id;
    private String label;
    private String kind = "participant";
    private boolean created;
    private boolean destroyed;

    public Participant(String id) {
        this.id = id;
        this.label = id;
    }

    public String getId()       { return id; }
    public String getLabel()    { return label; }
    /** {@code participant} or {@code actor}. */
    public String getKind()     { return kind; }
    public boolean isCreated()  { return created; }
    public boolean isDestroyed() { return destroyed; }

    public void setLabel(String label)      { this.label = label; }
    public void setKind(String kind)        { this.kind = kind; }
    public void setCreated(boolean created) { this.created = created; }
    public void setDestroyed(boolean destroyed) { this.destroyed = destroyed; }

    @Override
    public String toString() {
        return "Participant{id='" + id + "', label='" + label + "', kind='" + kind + "'}";
    }
}
