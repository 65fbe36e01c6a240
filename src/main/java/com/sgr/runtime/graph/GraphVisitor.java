package com.sgr.runtime.graph;

public interface GraphVisitor<R> {

    R visitLeaf(LeafNode node);

    R visitSequential(SequentialNode node);

    R visitParallel(ParallelNode node);

    R visitCoordinator(CoordinatorNode node);

    R visitHub(HubNode node);
}
