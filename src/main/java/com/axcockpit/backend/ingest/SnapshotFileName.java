package com.axcockpit.backend.ingest;

import com.axcockpit.backend.error.CockpitException;
import com.axcockpit.backend.error.ErrorKind;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 스냅샷 파일명(YYYY-MM-DD.xlsx) → 스냅샷 날짜
 */
public final class SnapshotFileName {

    private static final Pattern NAME = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})\\.xlsx$", Pattern.CASE_INSENSITIVE);

    private SnapshotFileName() {}

    public static LocalDate parse(String filename) {
        if (filename == null) {
            throw new CockpitException(ErrorKind.INVALID_FILENAME, "Filename is missing");
        }
        // 업로드 경로가 붙어 오는 경우가 있다
        String base = filename.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1).trim();

        Matcher m = NAME.matcher(base);
        if (!m.matches()) {
            throw new CockpitException(ErrorKind.INVALID_FILENAME,
                    "Invalid filename '" + base + "': expected YYYY-MM-DD.xlsx");
        }
        try {
            return LocalDate.parse(m.group(1));
        } catch (DateTimeParseException e) {
            throw new CockpitException(ErrorKind.INVALID_FILENAME, "Invalid date in filename '" + base + "'", e);
        }
    }

    public static boolean matches(String filename) {
        try {
            parse(filename);
            return true;
        } catch (CockpitException e) {
            return false;
        }
    }
}
