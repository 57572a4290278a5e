package com.deporacle.engine.collector;

import com.deporacle.engine.model.LicenseRisk;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps free-form license strings to SPDX identifiers and a risk class.
 *
 * <p>
 * Permissive licenses are safe, weak copyleft is cautious, strong and network
 * copyleft is risky. Compound SPDX expressions ({@code MIT OR Apache-2.0})
 * resolve to their first recognized operand.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class LicenseClassifier {

    /** Normalized license: SPDX identifier (may be the raw text when unrecognized), risk and OSI status. */
    public record Classification(String spdx, LicenseRisk risk, boolean osiApproved) {
    }

    private static final Map<String, LicenseRisk> RISK = new HashMap<>();
    private static final Map<String, String> ALIASES = new HashMap<>();
    private static final Set<String> OSI_APPROVED = Set.of(
            "MIT", "ISC", "BSD-2-Clause", "BSD-3-Clause", "Apache-2.0", "0BSD", "Unlicense",
            "LGPL-2.1", "LGPL-2.1-only", "LGPL-2.1-or-later",
            "LGPL-3.0", "LGPL-3.0-only", "LGPL-3.0-or-later",
            "MPL-2.0", "EPL-2.0", "EPL-1.0",
            "GPL-2.0", "GPL-2.0-only", "GPL-2.0-or-later",
            "GPL-3.0", "GPL-3.0-only", "GPL-3.0-or-later",
            "AGPL-3.0", "AGPL-3.0-only", "AGPL-3.0-or-later",
            "CDDL-1.0", "Artistic-2.0", "Zlib", "PostgreSQL", "EUPL-1.2", "ECL-2.0", "PSF-2.0");

    static {
        for (String id : new String[] {"MIT", "ISC", "BSD-2-Clause", "BSD-3-Clause", "Apache-2.0", "Unlicense",
                "0BSD", "CC0-1.0", "CC-BY-4.0", "Zlib", "BlueOak-1.0.0", "MIT-0", "PSF-2.0", "Python-2.0"}) {
            RISK.put(id, LicenseRisk.SAFE);
        }
        for (String id : new String[] {"LGPL-2.1", "LGPL-2.1-only", "LGPL-2.1-or-later", "LGPL-3.0",
                "LGPL-3.0-only", "LGPL-3.0-or-later", "MPL-2.0", "EPL-2.0", "EPL-1.0", "CDDL-1.0", "CDDL-1.1"}) {
            RISK.put(id, LicenseRisk.CAUTIOUS);
        }
        for (String id : new String[] {"GPL-2.0", "GPL-2.0-only", "GPL-2.0-or-later", "GPL-3.0", "GPL-3.0-only",
                "GPL-3.0-or-later", "AGPL-3.0", "AGPL-3.0-only", "AGPL-3.0-or-later", "SSPL-1.0", "EUPL-1.2"}) {
            RISK.put(id, LicenseRisk.RISKY);
        }

        ALIASES.put("apache 2.0", "Apache-2.0");
        ALIASES.put("apache2", "Apache-2.0");
        ALIASES.put("apache-2", "Apache-2.0");
        ALIASES.put("apache license 2.0", "Apache-2.0");
        ALIASES.put("apache software license", "Apache-2.0");
        ALIASES.put("apache license, version 2.0", "Apache-2.0");
        ALIASES.put("mit license", "MIT");
        ALIASES.put("isc license", "ISC");
        ALIASES.put("isc license (iscl)", "ISC");
        ALIASES.put("bsd", "BSD-2-Clause");
        ALIASES.put("bsd-2", "BSD-2-Clause");
        ALIASES.put("bsd-3", "BSD-3-Clause");
        ALIASES.put("bsd license", "BSD-2-Clause");
        ALIASES.put("gpl", "GPL-3.0");
        ALIASES.put("gpl-2", "GPL-2.0");
        ALIASES.put("gpl-3", "GPL-3.0");
        ALIASES.put("gplv2", "GPL-2.0");
        ALIASES.put("gplv3", "GPL-3.0");
        ALIASES.put("gnu general public license v2 (gplv2)", "GPL-2.0");
        ALIASES.put("gnu general public license v3 (gplv3)", "GPL-3.0");
        ALIASES.put("lgpl", "LGPL-3.0");
        ALIASES.put("lgpl-2", "LGPL-2.1");
        ALIASES.put("lgpl-3", "LGPL-3.0");
        ALIASES.put("gnu lesser general public license v3 (lgplv3)", "LGPL-3.0");
        ALIASES.put("agpl", "AGPL-3.0");
        ALIASES.put("agpl-3", "AGPL-3.0");
        ALIASES.put("mpl", "MPL-2.0");
        ALIASES.put("mpl-2", "MPL-2.0");
        ALIASES.put("mozilla public license 2.0 (mpl 2.0)", "MPL-2.0");
        ALIASES.put("python software foundation license", "PSF-2.0");
        ALIASES.put("unlicensed", "Unlicense");
        ALIASES.put("public domain", "Unlicense");
        ALIASES.put("wtfpl", "WTFPL");
        ALIASES.put("cc0", "CC0-1.0");
        ALIASES.put("cc0-1.0", "CC0-1.0");
        ALIASES.put("artistic-2.0", "Artistic-2.0");
    }

    public Classification classify(String raw) {
        String spdx = toSpdx(raw);
        LicenseRisk risk = spdx == null ? LicenseRisk.UNKNOWN : RISK.getOrDefault(spdx, LicenseRisk.UNKNOWN);
        return new Classification(spdx, risk, spdx != null && OSI_APPROVED.contains(spdx));
    }

    /**
     * Normalize to an SPDX identifier. Unrecognized input is returned trimmed
     * so the original text is not lost; blank input yields null.
     */
    String toSpdx(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String trimmed = raw.trim();
        if (RISK.containsKey(trimmed) || OSI_APPROVED.contains(trimmed)) {
            return trimmed;
        }
        String alias = ALIASES.get(trimmed.toLowerCase(Locale.ROOT));
        if (alias != null) {
            return alias;
        }
        String stripped = trimmed.replaceAll("[()]", "");
        for (String part : stripped.split("(?i)\\s+(?:OR|AND)\\s+")) {
            String p = part.trim();
            if (RISK.containsKey(p)) {
                return p;
            }
            String partAlias = ALIASES.get(p.toLowerCase(Locale.ROOT));
            if (partAlias != null) {
                return partAlias;
            }
        }
        return trimmed;
    }
}
