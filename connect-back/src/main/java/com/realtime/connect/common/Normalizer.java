package com.realtime.connect.common;

import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class Normalizer {

    /** 무드 값은 소문자로 비교/저장. 공백이면 필터 없음(null) */
    @Nullable
    public String normalizeMood(@Nullable String mood) {
        if (mood == null) return null;
        String s = mood.trim();
        return s.isEmpty() ? null : s.toLowerCase(Locale.ROOT);
    }

    public boolean sameMood(@Nullable String a, @Nullable String b) {
        String na = normalizeMood(a);
        return na != null && na.equals(normalizeMood(b));
    }
}
