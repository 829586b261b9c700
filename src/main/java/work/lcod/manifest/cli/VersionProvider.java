package work.lcod.manifest.cli;

import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String version = Main.class.getPackage().getImplementationVersion();
        return new String[] { "manifest-import " + (version == null ? "development" : version) };
    }
}
