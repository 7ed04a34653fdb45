package com.baykanat.notifier.infrastructure.delivery;

import com.baykanat.notifier.domain.model.NotificationPayload;

/** Dış gönderim kanalı; herhangi bir RuntimeException denemenin başarısız olduğu anlamına gelir. */
public interface NotificationSender {

    void send(NotificationPayload notification);
}
