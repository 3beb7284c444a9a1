package com.example.plannerv1.exception;

/**
 * 保存済みパターンの設定が処理に必要な値を欠いている場合に送出する。
 * 例: 完了後繰り返しで daysAfterCompletion が未設定。
 */
public class RecurrenceConfigurationException extends BusinessException {

    private final String settingName;
    private final Object settingValue;

    public RecurrenceConfigurationException(String message, String settingName, Object settingValue) {
        super("CONFIGURATION_ERROR", message, settingName, settingValue);
        this.settingName = settingName;
        this.settingValue = settingValue;
    }

    public String getSettingName() {
        return settingName;
    }

    public Object getSettingValue() {
        return settingValue;
    }
}
