package com.calaccess.filings.domain.item;

// schedule holding the parent of a Schedule G item (EXPN_CD.G_FROM_E_F)
public enum ParentSchedule {
    E,
    F
}
