package com.raditha.metaast.cfg;

public record CfgEdge(int from, int to, EdgeLabel label) {
}
