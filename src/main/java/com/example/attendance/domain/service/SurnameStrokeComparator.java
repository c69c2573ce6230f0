package com.example.attendance.domain.service;

import java.util.Comparator;
import java.util.Map;

/**
 * Orders names by the stroke count of their first character, then by the full name.
 * Stroke counts come from a lookup of common surnames; other CJK characters get a rough
 * code-point based estimate so the ordering stays deterministic.
 */
public class SurnameStrokeComparator implements Comparator<String> {

    private static final int CJK_START = 0x4E00;
    private static final int CJK_END = 0x9FFF;
    private static final int NON_CJK_STROKES = 10;

    private static final Map<Character, Integer> STROKES = Map.ofEntries(
            Map.entry('丁', 2), Map.entry('王', 4), Map.entry('毛', 4), Map.entry('方', 4),
            Map.entry('文', 4), Map.entry('孔', 4), Map.entry('牛', 4),
            Map.entry('白', 5), Map.entry('石', 5), Map.entry('田', 5), Map.entry('史', 5),
            Map.entry('左', 5), Map.entry('古', 5), Map.entry('司', 5), Map.entry('甘', 5),
            Map.entry('朱', 6), Map.entry('江', 6), Map.entry('向', 6), Map.entry('任', 6),
            Map.entry('伍', 6), Map.entry('池', 6), Map.entry('安', 6),
            Map.entry('李', 7), Map.entry('吳', 7), Map.entry('何', 7), Map.entry('余', 7),
            Map.entry('宋', 7), Map.entry('呂', 7), Map.entry('杜', 7), Map.entry('沈', 7),
            Map.entry('汪', 7), Map.entry('巫', 7), Map.entry('辛', 7), Map.entry('阮', 7),
            Map.entry('邱', 7), Map.entry('吕', 7), Map.entry('冷', 7), Map.entry('沙', 7),
            Map.entry('林', 8), Map.entry('周', 8), Map.entry('金', 8), Map.entry('邵', 8),
            Map.entry('武', 8), Map.entry('范', 8), Map.entry('卓', 8), Map.entry('易', 8),
            Map.entry('尚', 8), Map.entry('祁', 8), Map.entry('柯', 8), Map.entry('柏', 8),
            Map.entry('施', 8),
            Map.entry('柳', 9), Map.entry('洪', 9), Map.entry('胡', 9), Map.entry('姚', 9),
            Map.entry('紀', 9), Map.entry('俞', 9), Map.entry('段', 9), Map.entry('祝', 9),
            Map.entry('侯', 9), Map.entry('姜', 9), Map.entry('封', 9), Map.entry('查', 9),
            Map.entry('孫', 10), Map.entry('高', 10), Map.entry('徐', 10), Map.entry('馬', 10),
            Map.entry('唐', 10), Map.entry('倪', 10), Map.entry('凌', 10), Map.entry('翁', 10),
            Map.entry('夏', 10), Map.entry('殷', 10), Map.entry('秦', 10), Map.entry('袁', 10),
            Map.entry('涂', 10),
            Map.entry('張', 11), Map.entry('陳', 11), Map.entry('許', 11), Map.entry('曹', 11),
            Map.entry('梁', 11), Map.entry('莊', 11), Map.entry('康', 11), Map.entry('郭', 11),
            Map.entry('黃', 12), Map.entry('曾', 12), Map.entry('程', 12), Map.entry('彭', 12),
            Map.entry('傅', 12), Map.entry('富', 12), Map.entry('游', 12),
            Map.entry('楊', 13), Map.entry('葉', 13), Map.entry('董', 13), Map.entry('溫', 13),
            Map.entry('詹', 13), Map.entry('雷', 13),
            Map.entry('廖', 14), Map.entry('趙', 14), Map.entry('熊', 14),
            Map.entry('劉', 15), Map.entry('蔣', 15), Map.entry('蔡', 15), Map.entry('鄭', 15),
            Map.entry('蕭', 15),
            Map.entry('賴', 16), Map.entry('錢', 16), Map.entry('盧', 16), Map.entry('龍', 16),
            Map.entry('謝', 17), Map.entry('鍾', 17), Map.entry('戴', 17), Map.entry('鄧', 17),
            Map.entry('魏', 18), Map.entry('蘇', 19), Map.entry('羅', 19), Map.entry('龔', 22)
    );

    @Override
    public int compare(String left, String right) {
        int byStrokes = Integer.compare(strokeKey(left), strokeKey(right));
        if (byStrokes != 0) {
            return byStrokes;
        }
        return nullToEmpty(left).compareTo(nullToEmpty(right));
    }

    /**
     * @param name full name
     * @return stroke count of the first character, {@code 0} for blank names
     */
    static int strokeKey(String name) {
        if (name == null || name.isEmpty()) {
            return 0;
        }
        return countStrokes(name.charAt(0));
    }

    static int countStrokes(char first) {
        Integer known = STROKES.get(first);
        if (known != null) {
            return known;
        }
        if (first >= CJK_START && first <= CJK_END) {
            return ((first - CJK_START) % 20) + 5;
        }
        return NON_CJK_STROKES;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
