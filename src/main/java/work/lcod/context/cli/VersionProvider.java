package work.lcod.context.cli;

import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] { "context-run " + (implementationVersion != null ? implementationVersion : "development") };
    }
}
