package com.abandonflow.analyzer.model;

import lombok.Getter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 以 10 位号码为键的放弃汇总，是每个客户在一次分析中的最终记录。
 * 第一次放弃时创建，之后只会追加放弃事件或写入回访结果。
 */
@Getter
public class PhoneAbandonAggregate {

    private final String phone;

    /** 第一次出现时的原始号码，仅用于展示 */
    private final String originalPhone;

    private LocalDateTime firstAbandonTime;
    private String firstAbandonTimeText;
    private LocalDate firstAbandonBusinessDate;

    private final List<AbandonEvent> abandonEvents = new ArrayList<>();
    private int totalAbandonCalls;

    private ResolutionStatus recoveryStatus = ResolutionStatus.NEEDS_OUTBOUND;
    private RecoveryAttempt recoveryAttempt;

    public PhoneAbandonAggregate(String phone, String originalPhone, AbandonEvent firstEvent) {
        this.phone = phone;
        this.originalPhone = originalPhone;
        this.firstAbandonTime = firstEvent.getCallTime();
        this.firstAbandonTimeText = firstEvent.getCallTimeText();
        this.firstAbandonBusinessDate = firstEvent.getBusinessDate();
        addEvent(firstEvent);
    }

    public List<AbandonEvent> getAbandonEvents() {
        return Collections.unmodifiableList(abandonEvents);
    }

    /**
     * 追加一次放弃；输入可能乱序，所以首次放弃取最早的那次。
     */
    public void addEvent(AbandonEvent event) {
        abandonEvents.add(event);
        totalAbandonCalls++;
        if (event.getCallTime().isBefore(firstAbandonTime)) {
            firstAbandonTime = event.getCallTime();
            firstAbandonTimeText = event.getCallTimeText();
            firstAbandonBusinessDate = event.getBusinessDate();
        }
    }

    /**
     * 记录一次未成功的接触。只保留第一次，后续未成功的接触直接忽略。
     */
    public void recordTentativeAttempt(RecoveryAttempt attempt) {
        if (recoveryAttempt != null) {
            return;
        }
        transitionTo(ResolutionStatus.ATTEMPTED);
        this.recoveryAttempt = attempt;
    }

    /** 成功接触覆盖之前记录的未成功接触 */
    public void markRecovered(RecoveryAttempt attempt) {
        transitionTo(ResolutionStatus.RECOVERED);
        this.recoveryAttempt = attempt;
    }

    public boolean isRecovered() {
        return recoveryStatus == ResolutionStatus.RECOVERED;
    }

    private void transitionTo(ResolutionStatus target) {
        if (!recoveryStatus.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Illegal status transition for " + phone + ": " + recoveryStatus + " -> " + target);
        }
        this.recoveryStatus = target;
    }
}
