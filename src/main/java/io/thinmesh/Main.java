package io.thinmesh;

import io.thinmesh.cli.ThinMeshCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = ThinMeshCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}
