package io.laneboard.util;

import java.util.UUID;
import java.util.regex.Pattern;

public final class Ids {
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9_.:-]{1,80}");

    private Ids() {
    }

    public static String newTaskId() {
        return "tsk_" + UUID.randomUUID();
    }

    public static String newCommentId() {
        return "cmt_" + UUID.randomUUID();
    }

    public static String newLockToken() {
        return "lck_" + UUID.randomUUID();
    }

    public static boolean isValid(String id) {
        return id != null && VALID_ID.matcher(id).matches();
    }
}
