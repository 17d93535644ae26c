package com.ethnicthv.lesser.benchmark;

import com.ethnicthv.lesser.core.type.Struct;

@Struct.Layout(Struct.LayoutType.SEQUENTIAL)
public class Row implements Struct {
    @Field
    String s;
    @Field
    int i;
}
