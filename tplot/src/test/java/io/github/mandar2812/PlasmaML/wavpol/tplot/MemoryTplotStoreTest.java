package io.github.mandar2812.PlasmaML.wavpol.tplot;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MemoryTplotStoreTest {

    @Test
    void storesAndReplaces() {
        MemoryTplotStore store = new MemoryTplotStore();
        assertThat( store.getVariable( "b" ) ).isNull();
        TplotVariable v1 = new TplotVariable( new double[ 2 ],
                                              new double[ 2 ][ 3 ] );
        TplotVariable v2 = new TplotVariable( new double[ 4 ],
                                              new double[ 4 ][ 1 ] );
        store.storeVariable( "b", v1 );
        assertThat( store.getVariable( "b" ) ).isSameAs( v1 );
        store.storeVariable( "b", v2 );
        assertThat( store.getVariable( "b" ) ).isSameAs( v2 );
        assertThat( store.getNames( "*" ) ).containsExactly( "b" );
    }

    @Test
    void globMatching() {
        MemoryTplotStore store = new MemoryTplotStore();
        for ( String name : new String[] { "th_fgs", "th_fgl", "mms1_b.gse",
                                           "mms1_bxgse" } ) {
            store.storeVariable( name, new TplotVariable( new double[ 0 ],
                                                          new double[ 0 ][] ) );
        }
        assertThat( store.getNames( "th_*" ) )
            .containsExactly( "th_fgs", "th_fgl" );
        assertThat( store.getNames( "th_fg?" ) )
            .containsExactly( "th_fgs", "th_fgl" );
        assertThat( store.getNames( "mms1_b.gse" ) )
            .containsExactly( "mms1_b.gse" );
        assertThat( store.getNames( "*gse" ) ).hasSize( 2 );
        assertThat( store.getNames( "nothing" ) ).isEmpty();
    }

    @Test
    void variableColumns() {
        double[][] values = { { 1, 2, 3 }, { 4, 5, 6 } };
        TplotVariable var = new TplotVariable( new double[] { 0, 1 }, values,
                                               new double[] { 10, 20, 30 } );
        assertThat( var.getColumnCount() ).isEqualTo( 3 );
        assertThat( var.getColumn( 1 ) ).containsExactly( 2, 5 );
        var.setOption( "spec", 1 );
        assertThat( var.getOptions() ).containsEntry( "spec", 1 );
        assertThat( var.toString() ).isEqualTo( "2 x 3 (v: 3)" );
    }
}
