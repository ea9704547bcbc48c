package com.ewale.ewale.entity;

public enum BuyerFlow {
    SELF,   // Buying for the dialling number
    OTHER   // Buying for another mobile number
}
