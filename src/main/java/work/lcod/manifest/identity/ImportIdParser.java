package work.lcod.manifest.identity;

import work.lcod.manifest.pipeline.ErrorKind;
import work.lcod.manifest.pipeline.ImportException;

/**
 * Parses the identifier an operator passes on the import command line.
 *
 * <p>Accepted forms, {@code #} being the only separator:
 * <pre>
 * &lt;apiVersion&gt;#&lt;Kind&gt;#&lt;name&gt;               cluster-scoped
 * &lt;apiVersion&gt;#&lt;Kind&gt;#&lt;namespace&gt;#&lt;name&gt;   namespaced
 * </pre>
 * where {@code apiVersion} is either a bare version ({@code v1}, core group) or {@code group/version}.
 * Example: {@code v1#Secret#default#default-token-qgm6s}.
 *
 * <p>Segment contents are not validated here; an illegal name surfaces when the object is fetched.
 */
public final class ImportIdParser {
    private static final String SEPARATOR = "#";

    private ImportIdParser() {}

    public static ResourceIdentity parse(String id) {
        if (id == null) {
            throw new ImportException(ErrorKind.PARSE, "import ID is required");
        }
        String[] parts = id.split(SEPARATOR, -1);
        if (parts.length < 3 || parts.length > 4) {
            throw new ImportException(
                ErrorKind.PARSE,
                "invalid format for import ID [" + id + "]: expected <apiVersion>#<Kind>#[<namespace>#]<name>"
            );
        }
        var gvk = parseGroupVersion(parts[0], parts[1], id);
        if (parts.length == 4) {
            return new ResourceIdentity(gvk, parts[2], parts[3]);
        }
        return new ResourceIdentity(gvk, "", parts[2]);
    }

    private static GroupVersionKind parseGroupVersion(String apiVersion, String kind, String id) {
        int slash = apiVersion.indexOf('/');
        if (slash < 0) {
            return new GroupVersionKind("", apiVersion, kind);
        }
        if (apiVersion.indexOf('/', slash + 1) >= 0) {
            throw new ImportException(
                ErrorKind.PARSE,
                "invalid apiVersion '" + apiVersion + "' in import ID [" + id + "]: expected <version> or <group>/<version>"
            );
        }
        return new GroupVersionKind(apiVersion.substring(0, slash), apiVersion.substring(slash + 1), kind);
    }
}
