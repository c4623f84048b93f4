package com.team.qametrics.model.ticket;

/**
 * Ticket 狀態的分類，在計分開始時解析一次。
 */
public enum TicketStatusCategory {
    OPEN,
    CLOSED
}
