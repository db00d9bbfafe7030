package fr.lapetina.mesh.domain.routing;

public enum CanaryStatus {
    RUNNING,
    PROMOTED,
    ROLLED_BACK;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
