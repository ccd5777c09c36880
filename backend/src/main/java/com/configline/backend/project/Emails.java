package com.configline.backend.project;

import java.util.Locale;

public final class Emails {
    private Emails() {}

    public static String normalize(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
