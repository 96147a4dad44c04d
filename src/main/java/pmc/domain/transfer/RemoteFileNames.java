package pmc.domain.transfer;

import pmc.common.PrinterConstants;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Printer side file names: safe characters only, always .3mf, bounded length
 * @author Martin Sustik <sustik@herman.cz>
 * @since 07/10/2026
 */
public final class RemoteFileNames {
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_.-]");
    private static final Pattern UPLOAD_PREFIX = Pattern.compile("^[0-9a-fA-F-]+_[0-9a-fA-F-]+_(.+)$");

    private RemoteFileNames() {
    }

    public static String sanitize(String name) {
        String base = UNSAFE.matcher(name == null ? "" : name.trim()).replaceAll("_");
        if (base.isEmpty()) {
            base = "upload";
        }
        if (base.toLowerCase(Locale.ROOT).endsWith(".gcode")) {
            base = base.substring(0, base.length() - ".gcode".length());
            if (base.isEmpty()) {
                base = "upload";
            }
        }
        if (!base.toLowerCase(Locale.ROOT).endsWith(".3mf")) {
            int dot = base.lastIndexOf('.');
            String stem = dot > 0 ? base.substring(0, dot) : base;
            base = stem + ".3mf";
        }

        int max = PrinterConstants.REMOTE_NAME_MAX_LENGTH;
        if (base.length() > max) {
            String extension = base.substring(base.lastIndexOf('.'));
            base = base.substring(0, Math.max(1, max - extension.length())) + extension;
        }
        return base;
    }

    /**
     * Strip the "<uuid>_<uuid>_" prefix cloud downloads carry, then sanitize
     */
    public static String forTransfer(String localFileName) {
        String trimmed = localFileName == null ? "" : localFileName;
        var matcher = UPLOAD_PREFIX.matcher(trimmed);
        if (matcher.matches()) {
            trimmed = matcher.group(1);
        }
        return sanitize(trimmed);
    }
}
