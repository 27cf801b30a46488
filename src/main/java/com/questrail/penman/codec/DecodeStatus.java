package com.questrail.penman.codec;

public enum DecodeStatus
{
    OK,
    BACKOFF
}
