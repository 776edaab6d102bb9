package com.geico.poc.ttlindex.supervisor;

import java.util.Objects;

/**
 * Descriptor of a background worker to register with the {@link WorkerSupervisor}.
 */
public class BackgroundWorker {

    private final String name;
    private final String type;
    private final String libraryName;
    private final String functionName;
    private final long mainArg;
    private final RestartPolicy restartPolicy;
    private final StartCondition startCondition;

    public BackgroundWorker(String name, String type, String libraryName, String functionName,
                            long mainArg, RestartPolicy restartPolicy, StartCondition startCondition) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = type;
        this.libraryName = Objects.requireNonNull(libraryName, "libraryName");
        this.functionName = Objects.requireNonNull(functionName, "functionName");
        this.mainArg = mainArg;
        this.restartPolicy = Objects.requireNonNull(restartPolicy, "restartPolicy");
        this.startCondition = Objects.requireNonNull(startCondition, "startCondition");
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public String getLibraryName() {
        return libraryName;
    }

    public String getFunctionName() {
        return functionName;
    }

    /**
     * Argument handed to the entry point, e.g. a database oid
     */
    public long getMainArg() {
        return mainArg;
    }

    public RestartPolicy getRestartPolicy() {
        return restartPolicy;
    }

    public StartCondition getStartCondition() {
        return startCondition;
    }

    String entryPointKey() {
        return libraryName + "." + functionName;
    }

    @Override
    public String toString() {
        return name + " [" + entryPointKey() + ", restart=" + restartPolicy + ", start=" + startCondition + "]";
    }
}
