package ru.aritmos.crmbridge.model;

/**
 * Тип уведомления для дашборда.
 */
public enum NotificationType {
    /** Новое входящее или исходящее сообщение. */
    NEW_MESSAGE,
    /** Изменение статуса сообщения (доставлено, прочитано). */
    MESSAGE_STATUS_CHANGE,
    /** Статус подключения клиента или аккаунта. Адресные уведомления этого типа не попадают в историю. */
    CONNECTION_STATUS,
    /** Статус рассылки. */
    CAMPAIGN_STATUS,
    /** Действие пользователя дашборда. */
    USER_ACTION,
    /** Системное предупреждение. */
    SYSTEM_ALERT
}
