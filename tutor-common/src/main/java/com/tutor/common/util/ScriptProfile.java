package com.tutor.common.util;

import lombok.Value;

/**
 * 日文字符构成：平假名、片假名、汉字的计数与占比。
 */
@Value
public class ScriptProfile {

    int hiragana;
    int katakana;
    int kanji;

    public int total() {
        return hiragana + katakana + kanji;
    }

    /** 不含任何日文字符 */
    public boolean isEmpty() {
        return total() == 0;
    }

    public double kanjiRatio() {
        return ScoreUtils.ratio(kanji, total());
    }

    public double hiraganaRatio() {
        return ScoreUtils.ratio(hiragana, total());
    }
}
